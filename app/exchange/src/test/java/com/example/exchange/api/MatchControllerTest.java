package com.example.exchange.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.exchange.ExchangeTestRecords;
import com.example.exchange.api.response.MatchResponse;
import com.example.exchange.api.response.PageResponse;
import com.example.exchange.model.MatchRecord;
import com.example.exchange.model.MatchState;
import com.example.exchange.service.MatchLifecycleService;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(MatchController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class MatchControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private MatchLifecycleService lifecycleService;

  @Test
  void createMatchReturns201ForNewPair() throws Exception {
    final UUID offerId = UUID.randomUUID();
    final UUID requestId = UUID.randomUUID();
    final UUID matchId = UUID.randomUUID();
    when(lifecycleService.createPendingMatch(offerId, requestId, "seeker-b"))
        .thenReturn(new MatchLifecycleService.PendingMatch(matchId, true));

    mockMvc
        .perform(
            post("/v1/matches")
                .header("X-User-Id", "seeker-b")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"offer_id\":\"" + offerId + "\",\"request_id\":\"" + requestId + "\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.match_id").value(matchId.toString()));
  }

  @Test
  void createMatchReturns200ForExistingPair() throws Exception {
    final UUID offerId = UUID.randomUUID();
    final UUID requestId = UUID.randomUUID();
    when(lifecycleService.createPendingMatch(offerId, requestId, "seeker-b"))
        .thenReturn(new MatchLifecycleService.PendingMatch(UUID.randomUUID(), false));

    mockMvc
        .perform(
            post("/v1/matches")
                .header("X-User-Id", "seeker-b")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"offer_id\":\"" + offerId + "\",\"request_id\":\"" + requestId + "\"}"))
        .andExpect(status().isOk());
  }

  @Test
  void transitionReturnsUpdatedMatch() throws Exception {
    final MatchRecord accepted =
        ExchangeTestRecords.match(
            UUID.randomUUID(), "owner-a", "seeker-b", MatchState.ACCEPTED, 1, "owner-a");
    when(lifecycleService.transition(accepted.matchId(), "accept", "owner-a"))
        .thenReturn(MatchResponse.from(accepted));

    mockMvc
        .perform(
            post("/v1/matches/" + accepted.matchId() + "/transitions")
                .header("X-User-Id", "owner-a")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"accept\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("ACCEPTED"))
        .andExpect(jsonPath("$.version").value(1))
        .andExpect(jsonPath("$.awaiting_user_id").value("seeker-b"));
  }

  @Test
  void staleTransitionReturns409() throws Exception {
    final UUID matchId = UUID.randomUUID();
    when(lifecycleService.transition(matchId, "accept", "owner-a"))
        .thenThrow(new StaleTransitionException(matchId, "match was modified concurrently"));

    mockMvc
        .perform(
            post("/v1/matches/" + matchId + "/transitions")
                .header("X-User-Id", "owner-a")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"accept\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("STALE_TRANSITION"));
  }

  @Test
  void forbiddenTransitionReturns403() throws Exception {
    final UUID matchId = UUID.randomUUID();
    when(lifecycleService.transition(matchId, "confirm", "owner-a"))
        .thenThrow(new ForbiddenActionException("user may not confirm match " + matchId));

    mockMvc
        .perform(
            post("/v1/matches/" + matchId + "/transitions")
                .header("X-User-Id", "owner-a")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"confirm\"}"))
        .andExpect(status().isForbidden());
  }

  @Test
  void blankActionIsRejectedBeforeTheService() throws Exception {
    mockMvc
        .perform(
            post("/v1/matches/" + UUID.randomUUID() + "/transitions")
                .header("X-User-Id", "owner-a")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"action\":\"\"}"))
        .andExpect(status().isBadRequest());
    verifyNoInteractions(lifecycleService);
  }

  @Test
  void unknownMatchReturns404() throws Exception {
    final UUID matchId = UUID.randomUUID();
    when(lifecycleService.find(matchId, "owner-a")).thenThrow(new MatchNotFoundException(matchId));

    mockMvc
        .perform(get("/v1/matches/" + matchId).header("X-User-Id", "owner-a"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void mineForwardsStateFilter() throws Exception {
    final MatchRecord pending = ExchangeTestRecords.match("owner-a", "seeker-b", MatchState.PENDING, 0);
    when(lifecycleService.matchesFor("owner-a", "pending", 1, 20))
        .thenReturn(new PageResponse<>(List.of(MatchResponse.from(pending)), 1, 1, 20));

    mockMvc
        .perform(get("/v1/matches/mine?state=pending").header("X-User-Id", "owner-a"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[0].state").value("PENDING"))
        .andExpect(jsonPath("$.has_more").value(false));
  }

  @Test
  void unexpectedFailureIsMaskedAs500() throws Exception {
    when(lifecycleService.pendingFor(any(), anyInt(), anyInt()))
        .thenThrow(new IllegalStateException("db exploded"));

    mockMvc
        .perform(get("/v1/matches/pending").header("X-User-Id", "owner-a"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
        .andExpect(jsonPath("$.message").value("internal error"));
  }
}
