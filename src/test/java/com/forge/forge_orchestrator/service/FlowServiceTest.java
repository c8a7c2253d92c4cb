package com.forge.forge_orchestrator.service;

import com.forge.forge_orchestrator.engine.FlowExecutionEngine;
import com.forge.forge_orchestrator.engine.FlowRunResult;
import com.forge.forge_orchestrator.exception.FlowNotFoundException;
import com.forge.forge_orchestrator.exception.GenerationException;
import com.forge.forge_orchestrator.model.domain.Flow;
import com.forge.forge_orchestrator.repository.FlowRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FlowServiceTest {

    @Mock
    private FlowExecutionEngine engine;
    @Mock
    private FlowRepository flowRepository;

    @InjectMocks
    private FlowService service;

    @Test
    void backgroundTriggerSwallowsRunFailure() throws Exception {
        when(flowRepository.existsById(1L)).thenReturn(true);
        when(engine.execute(1L)).thenThrow(new GenerationException("boom"));

        service.triggerFlow(1L).get(5, TimeUnit.SECONDS);

        verify(engine).execute(1L);
    }

    @Test
    void triggerOfUnknownFlowFailsImmediately() {
        when(flowRepository.existsById(2L)).thenReturn(false);

        assertThatThrownBy(() -> service.triggerFlow(2L)).isInstanceOf(FlowNotFoundException.class);
        verify(engine, never()).execute(2L);
    }

    @Test
    void synchronousRunReturnsEngineResult() {
        FlowRunResult expected = new FlowRunResult(3L, 2, 0.5, 40L);
        when(engine.execute(3L)).thenReturn(expected);

        assertThat(service.runFlow(3L)).isEqualTo(expected);
    }

    @Test
    void createRejectsDuplicateName() {
        Flow flow = new Flow();
        flow.setName("  Release  ");
        when(flowRepository.existsByName("Release")).thenReturn(true);

        assertThatThrownBy(() -> service.createFlow(flow)).isInstanceOf(IllegalArgumentException.class);
        verify(flowRepository, never()).save(any());
    }

    @Test
    void updateReplacesGraphAndKeepsEmptyGraphWhenAbsent() {
        Flow stored = new Flow();
        stored.setId(5L);
        stored.setName("Release");
        stored.setGraphJson("{\"nodes\":[{\"id\":\"a\",\"type\":\"agent\"}]}");
        when(flowRepository.findById(5L)).thenReturn(Optional.of(stored));
        when(flowRepository.save(any(Flow.class))).thenAnswer(inv -> inv.getArgument(0));

        Flow changes = new Flow();
        changes.setName("Release");
        changes.setGraphJson(null);
        Flow updated = service.updateFlow(5L, changes);

        assertThat(updated.getGraphJson()).isEqualTo(Flow.EMPTY_GRAPH);
    }

    @Test
    void deleteOfUnknownFlowIsNotFound() {
        when(flowRepository.existsById(9L)).thenReturn(false);

        assertThatThrownBy(() -> service.deleteFlow(9L)).isInstanceOf(FlowNotFoundException.class);
    }
}
