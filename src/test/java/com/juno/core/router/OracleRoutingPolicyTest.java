package com.juno.core.router;

import com.juno.core.oracle.Oracle;
import com.juno.core.oracle.RouteDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class OracleRoutingPolicyTest {

    private static final List<String> MEMBERS = List.of("search", "web_scraper");

    private Oracle oracle;
    private OracleRoutingPolicy policy;

    @BeforeEach
    void setUp() {
        oracle = mock(Oracle.class);
        policy = new OracleRoutingPolicy(oracle);
    }

    @Test
    @DisplayName("a member named by the oracle is taken as is")
    void memberAnswer() {
        when(oracle.route(eq("research supervisor"), anyList(), eq(MEMBERS)))
                .thenReturn(new RouteDecision(" web_scraper ", "scrape first"));
        assertEquals("web_scraper", policy.next("research", state(List.of()), MEMBERS));
    }

    @Test
    @DisplayName("FINISH before any member has worked falls back to the first member")
    void earlyFinish() {
        when(oracle.route(anyString(), anyList(), anyList())).thenReturn(new RouteDecision("FINISH", ""));
        assertEquals("search", policy.next("research", state(List.of()), MEMBERS));
    }

    @Test
    @DisplayName("FINISH after a member has worked ends the team")
    void finishAfterWork() {
        when(oracle.route(anyString(), anyList(), anyList())).thenReturn(new RouteDecision("finish", ""));
        assertEquals(HubAndSpoke.FINISH, policy.next("research", state(List.of("search")), MEMBERS));
    }

    @Test
    @DisplayName("unknown answers and failures use the first unvisited member")
    void fallback() {
        when(oracle.route(anyString(), anyList(), anyList())).thenReturn(new RouteDecision("editor", ""));
        assertEquals("web_scraper", policy.next("research", state(List.of("search")), MEMBERS));

        reset(oracle);
        when(oracle.route(anyString(), anyList(), anyList())).thenThrow(new IllegalStateException("timeout"));
        assertEquals("search", policy.next("research", state(List.of()), MEMBERS));

        reset(oracle);
        when(oracle.route(anyString(), anyList(), anyList())).thenReturn(null);
        assertEquals(HubAndSpoke.FINISH, policy.next("research", state(MEMBERS), MEMBERS));
    }

    // ── Helper methods ──────────────────────────────────────────────

    private static TeamState state(List<String> visited) {
        var data = new HashMap<String, Object>();
        data.put("visited", visited);
        data.put("messages", List.of());
        return new TeamState(data);
    }
}
