package com.eainde.athlete.workflow;

import com.eainde.athlete.config.AgentProperties;
import com.eainde.athlete.edges.DomainRoute;
import com.eainde.athlete.edges.EvidenceRoute;
import com.eainde.athlete.edges.NeedsMoreInfoEdge;
import com.eainde.athlete.edges.QualityRoute;
import com.eainde.athlete.edges.RouteByDomainEdge;
import com.eainde.athlete.edges.RouteByQualityEdge;
import com.eainde.athlete.graph.ActiveRuns;
import com.eainde.athlete.graph.EnumCompiledGraph;
import com.eainde.athlete.graph.EnumStateGraph;
import com.eainde.athlete.graph.Target;
import com.eainde.athlete.nodes.CitationBuilderNode;
import com.eainde.athlete.nodes.ClarifyNode;
import com.eainde.athlete.nodes.ClassifierNode;
import com.eainde.athlete.nodes.DisclaimerGuardNode;
import com.eainde.athlete.nodes.EscalateNode;
import com.eainde.athlete.nodes.NodeId;
import com.eainde.athlete.nodes.QualityCheckerNode;
import com.eainde.athlete.nodes.QueryPlannerNode;
import com.eainde.athlete.nodes.ResearcherNode;
import com.eainde.athlete.nodes.RetrievalExpanderNode;
import com.eainde.athlete.nodes.RetrieverNode;
import com.eainde.athlete.nodes.SynthesizerNode;
import com.eainde.athlete.state.RunState;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executor;

import static com.eainde.athlete.nodes.NodeId.CITATION_BUILDER;
import static com.eainde.athlete.nodes.NodeId.CLARIFY;
import static com.eainde.athlete.nodes.NodeId.CLASSIFIER;
import static com.eainde.athlete.nodes.NodeId.DISCLAIMER_GUARD;
import static com.eainde.athlete.nodes.NodeId.ESCALATE;
import static com.eainde.athlete.nodes.NodeId.QUALITY_CHECKER;
import static com.eainde.athlete.nodes.NodeId.QUERY_PLANNER;
import static com.eainde.athlete.nodes.NodeId.RESEARCHER;
import static com.eainde.athlete.nodes.NodeId.RETRIEVAL_EXPANDER;
import static com.eainde.athlete.nodes.NodeId.RETRIEVER;
import static com.eainde.athlete.nodes.NodeId.SYNTHESIZER;

/**
 * Wires the answer pipeline. The planner and the quality loop can be switched off, in which
 * case their nodes are left out of the graph entirely.
 */
@Slf4j
@Component
public class AgentWorkflowGraph {

    private final ClassifierNode classifier;
    private final ClarifyNode clarify;
    private final QueryPlannerNode queryPlanner;
    private final RetrieverNode retriever;
    private final RetrievalExpanderNode retrievalExpander;
    private final ResearcherNode researcher;
    private final SynthesizerNode synthesizer;
    private final QualityCheckerNode qualityChecker;
    private final EscalateNode escalate;
    private final CitationBuilderNode citationBuilder;
    private final DisclaimerGuardNode disclaimerGuard;
    private final RouteByDomainEdge routeByDomain;
    private final NeedsMoreInfoEdge needsMoreInfo;
    private final RouteByQualityEdge routeByQuality;
    private final AgentProperties properties;

    public AgentWorkflowGraph(ClassifierNode classifier,
                              ClarifyNode clarify,
                              QueryPlannerNode queryPlanner,
                              RetrieverNode retriever,
                              RetrievalExpanderNode retrievalExpander,
                              ResearcherNode researcher,
                              SynthesizerNode synthesizer,
                              QualityCheckerNode qualityChecker,
                              EscalateNode escalate,
                              CitationBuilderNode citationBuilder,
                              DisclaimerGuardNode disclaimerGuard,
                              RouteByDomainEdge routeByDomain,
                              NeedsMoreInfoEdge needsMoreInfo,
                              RouteByQualityEdge routeByQuality,
                              AgentProperties properties) {
        this.classifier = classifier;
        this.clarify = clarify;
        this.queryPlanner = queryPlanner;
        this.retriever = retriever;
        this.retrievalExpander = retrievalExpander;
        this.researcher = researcher;
        this.synthesizer = synthesizer;
        this.qualityChecker = qualityChecker;
        this.escalate = escalate;
        this.citationBuilder = citationBuilder;
        this.disclaimerGuard = disclaimerGuard;
        this.routeByDomain = routeByDomain;
        this.needsMoreInfo = needsMoreInfo;
        this.routeByQuality = routeByQuality;
        this.properties = properties;
    }

    @Bean("answerWorkflow")
    public EnumCompiledGraph<NodeId, RunState> build(ObjectProvider<BaseCheckpointSaver> checkpointSaver,
                                                     ObjectProvider<MeterRegistry> meterRegistry,
                                                     ActiveRuns activeRuns,
                                                     @Qualifier("graphExecutor") Executor graphExecutor,
                                                     Clock clock) throws GraphStateException {
        boolean plannerEnabled = properties.getPlanner().isEnabled();
        boolean qualityEnabled = properties.getQuality().isEnabled();

        EnumStateGraph<NodeId, RunState> workflow = new EnumStateGraph<>(NodeId.class, RunState::new, activeRuns,
                meterRegistry.getIfAvailable());

        workflow.addNode(CLASSIFIER, classifier)
                .addNode(CLARIFY, clarify)
                .addNode(RETRIEVER, retriever)
                .addNode(RETRIEVAL_EXPANDER, retrievalExpander)
                .addNode(RESEARCHER, researcher)
                .addNode(SYNTHESIZER, synthesizer)
                .addNode(ESCALATE, escalate)
                .addNode(CITATION_BUILDER, citationBuilder)
                .addNode(DISCLAIMER_GUARD, disclaimerGuard);
        if (plannerEnabled) {
            workflow.addNode(QUERY_PLANNER, queryPlanner);
        }
        if (qualityEnabled) {
            workflow.addNode(QUALITY_CHECKER, qualityChecker);
        }

        workflow.setEntryPoint(CLASSIFIER);

        workflow.addConditionalEdges(CLASSIFIER, routeByDomain, Map.of(
                DomainRoute.CLARIFY, Target.of(CLARIFY),
                DomainRoute.ESCALATE, Target.of(ESCALATE),
                DomainRoute.PLAN, Target.of(plannerEnabled ? QUERY_PLANNER : RETRIEVER)));
        workflow.addEdge(CLARIFY, Target.end());
        if (plannerEnabled) {
            workflow.addEdge(QUERY_PLANNER, RETRIEVER);
        }

        Map<EvidenceRoute, Target<NodeId>> evidenceRoutes = Map.of(
                EvidenceRoute.SYNTHESIZE, Target.of(SYNTHESIZER),
                EvidenceRoute.EXPAND, Target.of(RETRIEVAL_EXPANDER),
                EvidenceRoute.RESEARCH, Target.of(RESEARCHER));
        workflow.addConditionalEdges(RETRIEVER, needsMoreInfo, evidenceRoutes);
        workflow.addConditionalEdges(RETRIEVAL_EXPANDER, needsMoreInfo, evidenceRoutes);
        workflow.addEdge(RESEARCHER, SYNTHESIZER);

        if (qualityEnabled) {
            workflow.addEdge(SYNTHESIZER, QUALITY_CHECKER);
            workflow.addConditionalEdges(QUALITY_CHECKER, routeByQuality, Map.of(
                    QualityRoute.ACCEPT, Target.of(CITATION_BUILDER),
                    QualityRoute.RETRY, Target.of(SYNTHESIZER)));
        } else {
            workflow.addEdge(SYNTHESIZER, CITATION_BUILDER);
        }

        workflow.addEdge(ESCALATE, CITATION_BUILDER);
        workflow.addEdge(CITATION_BUILDER, DISCLAIMER_GUARD);
        workflow.addEdge(DISCLAIMER_GUARD, Target.end());

        log.info("Compiling answer workflow (planner={}, qualityLoop={})", plannerEnabled, qualityEnabled);
        return workflow.compile(checkpointSaver.getIfAvailable(), graphExecutor, clock);
    }
}
