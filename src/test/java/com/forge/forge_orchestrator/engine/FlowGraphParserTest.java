package com.forge.forge_orchestrator.engine;

import com.forge.forge_orchestrator.exception.FlowParseException;
import com.forge.forge_orchestrator.model.graph.FlowGraph;
import com.forge.forge_orchestrator.model.graph.FlowGraphNode;
import com.forge.forge_orchestrator.support.TestJson;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlowGraphParserTest {

    private final FlowGraphParser parser = new FlowGraphParser(TestJson.mapper());

    @Test
    void parsesNodesInStoredOrderAndIgnoresCanvasFields() {
        String json = """
                {"nodes":[
                  {"id":"b","type":"agent","position":{"x":10,"y":20},
                   "data":{"label":"Build","role":"coder","prompt":"write it","provider":"OpenAI"}},
                  {"id":"a","type":"agent","data":{"label":"Plan","role":"planner","prompt":"plan it","provider":"Anthropic"}}
                 ],
                 "edges":[{"id":"e1","source":"a","target":"b","animated":true}]}
                """;

        FlowGraph graph = parser.parse(json);

        assertThat(graph.nodes()).extracting(FlowGraphNode::id).containsExactly("b", "a");
        assertThat(graph.nodes().get(0).data().provider()).isEqualTo("OpenAI");
        assertThat(graph.edges()).hasSize(1);
        assertThat(graph.edges().get(0).source()).isEqualTo("a");
    }

    @Test
    void missingArraysParseAsEmpty() {
        FlowGraph graph = parser.parse("{}");

        assertThat(graph.nodes()).isEmpty();
        assertThat(graph.edges()).isEmpty();
    }

    @Test
    void onlyAgentNodesAreExecutable() {
        FlowGraph graph = parser.parse("""
                {"nodes":[{"id":"t","type":"trigger"},{"id":"x","type":"agent"},{"id":"n","type":"note"}]}
                """);

        assertThat(graph.agentNodes()).extracting(FlowGraphNode::id).containsExactly("x");
        assertThat(graph.agentNodes().get(0).data().role()).isNull();
    }

    @Test
    void malformedJsonFails() {
        assertThatThrownBy(() -> parser.parse("{\"nodes\": [")).isInstanceOf(FlowParseException.class)
                .hasMessageStartingWith("failed to parse flow data");
    }

    @Test
    void blankOrNullInputFails() {
        assertThatThrownBy(() -> parser.parse("")).isInstanceOf(FlowParseException.class);
        assertThatThrownBy(() -> parser.parse(null)).isInstanceOf(FlowParseException.class);
        assertThatThrownBy(() -> parser.parse("null")).isInstanceOf(FlowParseException.class);
    }
}
