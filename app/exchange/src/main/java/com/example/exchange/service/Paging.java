package com.example.exchange.service;

import com.example.exchange.api.ValidationException;

/** 1 始まりのページ番号と上限つきのページ幅。 */
record Paging(int page, int pageSize) {

  static Paging of(int page, int pageSize, int maxPageSize) {
    if (page < 1) {
      throw new ValidationException("page must be >= 1");
    }
    if (pageSize < 1 || pageSize > maxPageSize) {
      throw new ValidationException("page_size must be between 1 and " + maxPageSize);
    }
    return new Paging(page, pageSize);
  }

  int offset() {
    return (page - 1) * pageSize;
  }
}
