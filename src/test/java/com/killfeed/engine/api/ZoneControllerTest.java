package com.killfeed.engine.api;

import com.killfeed.engine.domain.model.StarSystem;
import com.killfeed.engine.domain.model.ZoneClassification;
import com.killfeed.engine.domain.model.ZoneKnowledgeSource;
import com.killfeed.engine.domain.service.zone.HistoryFilter;
import com.killfeed.engine.domain.service.zone.ZoneDatabaseStats;
import com.killfeed.engine.domain.service.zone.ZoneHistoryManager;
import com.killfeed.engine.domain.service.zone.ZoneResolver;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ZoneController.class)
class ZoneControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ZoneResolver zoneResolver;

    @MockBean
    private ZoneHistoryManager zoneHistoryManager;

    @Test
    void historyParsesFiltersCaseInsensitively() throws Exception {
        when(zoneHistoryManager.getHistory(any())).thenReturn(List.of());
        when(zoneHistoryManager.getCurrentSystem()).thenReturn(StarSystem.PYRO);
        when(zoneHistoryManager.getCurrentZone()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/zones/history")
                        .param("classification", "primary")
                        .param("system", "Pyro")
                        .param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.currentSystem").value("PYRO"));

        verify(zoneHistoryManager).getHistory(
                new HistoryFilter(ZoneClassification.PRIMARY, StarSystem.PYRO, null, 5));
    }

    @Test
    void unknownClassificationIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/zones/type/nebula"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("unknown ZoneClassification: nebula"));

        verify(zoneResolver, never()).getZonesByClassification(any(), any());
    }

    @Test
    void knowledgeBaseUpdateIsTaggedAsServerSource() throws Exception {
        when(zoneResolver.getDatabaseStats()).thenReturn(new ZoneDatabaseStats(
                0, 0, 0, Map.of(), 1L, "2024.05", ZoneKnowledgeSource.SERVER));

        mockMvc.perform(put("/api/zones/knowledge-base")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"version\":\"2024.05\",\"replace\":true,\"zones\":[]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("knowledge base updated"))
                .andExpect(jsonPath("$.stats.version").value("2024.05"));

        verify(zoneResolver).updateKnowledgeBase(anyCollection(), eq("2024.05"),
                eq(ZoneKnowledgeSource.SERVER), anyBoolean());
    }
}
