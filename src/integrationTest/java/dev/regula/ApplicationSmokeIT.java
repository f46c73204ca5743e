package dev.regula;

import static org.assertj.core.api.Assertions.assertThat;

import dev.regula.answer.AnswerService;
import dev.regula.retrieval.Backend;
import dev.regula.retrieval.RetrievalAdapter;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.annotation.Autowired;

class ApplicationSmokeIT extends BaseIntegrationTest {

  @Autowired AnswerService answerService;

  @Autowired List<RetrievalAdapter> adapters;

  @Autowired ToolCallbackProvider regulaTools;

  @Test
  void context_wires_every_backend_adapter() {
    assertThat(answerService).isNotNull();
    assertThat(adapters)
        .extracting(RetrievalAdapter::backend)
        .containsExactlyInAnyOrder(Backend.HYBRID, Backend.GRAPH, Backend.FULL_TEXT);
  }

  @Test
  void mcp_tools_are_registered() {
    assertThat(regulaTools.getToolCallbacks())
        .extracting(callback -> callback.getToolDefinition().name())
        .containsExactlyInAnyOrder("ask_regulations", "analyze_question");
  }
}
