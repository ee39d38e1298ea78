package com.eainde.research.config;

import com.eainde.research.agent.ClasspathPromptService;
import com.eainde.research.agent.PromptService;
import com.eainde.research.agent.ResearchAgentFactory;
import com.eainde.research.agent.ResearchRole;
import com.eainde.research.engine.Critic;
import com.eainde.research.engine.Finder;
import com.eainde.research.engine.IterativeResearchService;
import com.eainde.research.engine.PlanScheduler;
import com.eainde.research.engine.ResearchPlanner;
import com.eainde.research.engine.ResearchSynthesizer;
import com.eainde.research.engine.SubtaskRunner;
import com.eainde.research.parse.ResponseParser;
import com.eainde.research.task.AgentTaskBroker;
import com.eainde.research.task.AgentTaskWorker;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.langchain4j.model.chat.ChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the research engine from two host-provided chat models.
 *
 * <pre>
 *   finderChatModel ──► Finder ──────────────┐
 *                                            ├──► SubtaskRunner ──► PlanScheduler ─┐
 *   criticChatModel ──► planner critic ──► ResearchPlanner ───────────────────────┤
 *                   ├─► evaluator critic ────┘                                     ├──► IterativeResearchService
 *                   └─► synthesizer critic ──► ResearchSynthesizer ────────────────┘
 * </pre>
 *
 * <p>The {@link AgentTaskWorker} is only created when the host supplies an {@link AgentTaskBroker}.</p>
 */
@Configuration
@EnableConfigurationProperties(ResearchProperties.class)
public class ResearchConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ResearchConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock researchClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResponseParser responseParser(ObjectMapper objectMapper) {
        return new ResponseParser(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public PromptService promptService(ResearchProperties properties) {
        return new ClasspathPromptService(properties.getPromptLocation());
    }

    @Bean
    public ResearchAgentFactory researchAgentFactory(@Qualifier("finderChatModel") ChatModel finderChatModel,
                                                     @Qualifier("criticChatModel") ChatModel criticChatModel,
                                                     PromptService promptService) {
        return new ResearchAgentFactory(finderChatModel, criticChatModel, promptService);
    }

    @Bean
    public Finder finder(ResearchAgentFactory agentFactory) {
        return agentFactory.finder();
    }

    @Bean
    public ResearchPlanner researchPlanner(ResearchAgentFactory agentFactory, ResponseParser responseParser) {
        return new ResearchPlanner(agentFactory.critic(ResearchRole.PLANNER), responseParser);
    }

    @Bean
    public SubtaskRunner subtaskRunner(Finder finder,
                                       ResearchAgentFactory agentFactory,
                                       ResponseParser responseParser,
                                       ResearchProperties properties) {
        Critic evaluator = agentFactory.critic(ResearchRole.EVALUATOR);
        log.info("Subtask runner: max {} iteration(s), quality threshold {}/10",
                properties.getMaxIterations(), properties.getQualityThreshold());
        return new SubtaskRunner(finder, evaluator, responseParser,
                properties.getMaxIterations(),
                properties.getQualityThreshold(),
                properties.getFindingsPreviewLength());
    }

    @Bean
    public PlanScheduler planScheduler(SubtaskRunner subtaskRunner) {
        return new PlanScheduler(subtaskRunner);
    }

    @Bean
    public ResearchSynthesizer researchSynthesizer(ResearchAgentFactory agentFactory,
                                                   ResponseParser responseParser,
                                                   ResearchProperties properties) {
        return new ResearchSynthesizer(agentFactory.critic(ResearchRole.SYNTHESIZER), responseParser,
                properties.getContentLossRatio(), properties.getContentLossMinBytes());
    }

    @Bean
    public IterativeResearchService iterativeResearchService(ResearchPlanner planner,
                                                             PlanScheduler scheduler,
                                                             ResearchSynthesizer synthesizer,
                                                             Finder finder,
                                                             Clock researchClock) {
        return new IterativeResearchService(planner, scheduler, synthesizer, finder, researchClock);
    }

    @Bean
    @ConditionalOnBean(AgentTaskBroker.class)
    public AgentTaskWorker agentTaskWorker(IterativeResearchService researchService,
                                           AgentTaskBroker broker,
                                           ObjectMapper objectMapper,
                                           Clock researchClock) {
        return new AgentTaskWorker(researchService, broker, objectMapper, researchClock);
    }
}
