package com.deepansh.orchestrator.plan;

import com.deepansh.orchestrator.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoPlanStoreTest {

    @Mock StoredPlanRepository repository;

    private MongoPlanStore store;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getCategories().put("technical-troubleshooting", new AgentProperties.Category());
        store = new MongoPlanStore(repository, properties);
    }

    @Test
    void getPlan_exactMatch_returnsStoredPlan() {
        when(repository.findFirstByQueryAndCategory("pump noise", "technical-troubleshooting"))
                .thenReturn(Optional.of(StoredPlan.builder().plan("1. Listen").build()));

        assertThat(store.getPlan("pump noise", "technical-troubleshooting")).contains("1. Listen");
    }

    @Test
    void getPlan_unknownCategory_neverQueriesStore() {
        assertThat(store.getPlan("pump noise", "made-up")).isEmpty();
        verifyNoInteractions(repository);
    }

    @Test
    void getPlan_storeFailure_isTreatedAsMiss() {
        when(repository.findFirstByQueryAndCategory(any(), any()))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertThat(store.getPlan("q", "technical-troubleshooting")).isEmpty();
    }

    @Test
    void putPlan_existingEntry_isOverwritten() {
        StoredPlan existing = StoredPlan.builder().id("p1").query("q").category("technical-troubleshooting")
                .plan("old").build();
        when(repository.findFirstByQueryAndCategory("q", "technical-troubleshooting")).thenReturn(Optional.of(existing));

        store.putPlan("q", "new plan", "technical-troubleshooting");

        ArgumentCaptor<StoredPlan> captor = ArgumentCaptor.forClass(StoredPlan.class);
        verify(repository).save(captor.capture());
        assertThat(captor.getValue().getId()).isEqualTo("p1");
        assertThat(captor.getValue().getPlan()).isEqualTo("new plan");
    }

    @Test
    void putPlan_unknownCategoryOrBlankPlan_isIgnored() {
        store.putPlan("q", "plan", "made-up");
        store.putPlan("q", "  ", "technical-troubleshooting");

        verify(repository, never()).save(any());
    }
}
