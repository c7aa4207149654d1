package com.eainde.analysis.workflow;

import com.eainde.analysis.edges.StageRoutingEdge;
import com.eainde.analysis.nodes.AnalyzeNode;
import com.eainde.analysis.nodes.CalculateNode;
import com.eainde.analysis.nodes.ExtractNode;
import com.eainde.analysis.nodes.FormatNode;
import com.eainde.analysis.nodes.StageNode;
import com.eainde.analysis.nodes.ValidateNode;
import com.eainde.analysis.state.AnalysisState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * The five stages as a linear graph. After every stage but the last a conditional edge either moves on
 * or, when the stage failed, ends the graph.
 */
@Component
public class AnalysisWorkflowGraph {

    private final List<StageNode<?>> stages;
    private final StageRoutingEdge routingEdge;

    public AnalysisWorkflowGraph(ExtractNode extractNode,
                                 CalculateNode calculateNode,
                                 ValidateNode validateNode,
                                 AnalyzeNode analyzeNode,
                                 FormatNode formatNode,
                                 StageRoutingEdge routingEdge) {
        this.stages = List.of(extractNode, calculateNode, validateNode, analyzeNode, formatNode);
        this.routingEdge = routingEdge;
    }

    @Bean("analysisWorkflow")
    public CompiledGraph<AnalysisState> build() throws GraphStateException {

        StateGraph<AnalysisState> workflow = new StateGraph<>(AnalysisState::new);

        for (StageNode<?> stage : stages) {
            workflow.addNode(stage.stage().nodeId(), stage);
        }

        workflow.addEdge(START, stages.get(0).stage().nodeId());

        for (int i = 0; i < stages.size() - 1; i++) {
            workflow.addConditionalEdges(
                    stages.get(i).stage().nodeId(),
                    routingEdge,
                    Map.of(
                            StageRoutingEdge.NEXT, stages.get(i + 1).stage().nodeId(),
                            StageRoutingEdge.FAILED, END
                    )
            );
        }

        workflow.addEdge(stages.get(stages.size() - 1).stage().nodeId(), END);

        return workflow.compile();
    }
}
