package com.flamingo.ai.smartnotes.config;

import com.flamingo.ai.smartnotes.agent.NoteDraftAgent;
import com.flamingo.ai.smartnotes.agent.NoteRevisionAgent;
import com.flamingo.ai.smartnotes.agent.TopicEnrichmentAgent;
import com.flamingo.ai.smartnotes.agent.TopicMergeNamingAgent;
import com.flamingo.ai.smartnotes.agent.TopicSegmentationAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the engine's AI agents using LangChain4j AI Services.
 *
 * <p>Pattern: agent interfaces declare prompts with @SystemMessage/@UserMessage; AiServices builds
 * the implementations. Agents returning records use the JSON-mode chatModel.
 */
@Configuration
public class AiAgentConfig {

  /** Segments numbered content blocks into topics. */
  @Bean
  public TopicSegmentationAgent topicSegmentationAgent(
      @Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(TopicSegmentationAgent.class).chatModel(chatModel).build();
  }

  /** Names the topic produced by a merge. */
  @Bean
  public TopicMergeNamingAgent topicMergeNamingAgent(@Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(TopicMergeNamingAgent.class).chatModel(chatModel).build();
  }

  /** Drafts the structured body of a topic note. */
  @Bean
  public NoteDraftAgent noteDraftAgent(@Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(NoteDraftAgent.class).chatModel(chatModel).build();
  }

  /** Applies a user instruction to an existing note. */
  @Bean
  public NoteRevisionAgent noteRevisionAgent(@Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(NoteRevisionAgent.class).chatModel(chatModel).build();
  }

  /**
   * Supplementary material for thin topics. Uses textChatModel (no JSON response format) for
   * free-form text output.
   */
  @Bean
  public TopicEnrichmentAgent topicEnrichmentAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(TopicEnrichmentAgent.class).chatModel(textChatModel).build();
  }
}
