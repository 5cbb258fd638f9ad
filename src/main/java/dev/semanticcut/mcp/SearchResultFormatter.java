package dev.semanticcut.mcp;

import dev.semanticcut.search.RankedResult;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Renders ranked clips as text blocks for tool output, within a token budget.
 *
 * <p>Tokens are estimated as characters / 4. Results are appended until the next block would
 * exceed the budget; a first block that alone exceeds it is cut at the character level so at
 * least one result is always shown.
 */
@Component
public class SearchResultFormatter {

  private static final double CHARS_PER_TOKEN = 4.0;

  private final int tokenBudget;

  public SearchResultFormatter(@Value("${semanticcut.mcp.token-budget:5000}") int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  public String format(@Nullable List<RankedResult> results) {
    if (results == null || results.isEmpty()) {
      return "";
    }

    StringBuilder output = new StringBuilder();
    int estimatedTokens = 0;
    for (int i = 0; i < results.size(); i++) {
      String block = formatResult(i + 1, results.get(i));
      int blockTokens = estimateTokens(block);

      if (i == 0 && blockTokens > tokenBudget) {
        int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
        output.append(block, 0, Math.min(maxChars, block.length()));
        break;
      }
      if (estimatedTokens + blockTokens > tokenBudget) {
        break;
      }
      output.append(block);
      estimatedTokens += blockTokens;
    }
    return output.toString();
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private String formatResult(int rank, RankedResult result) {
    Map<String, Object> metadata = result.metadata();
    return String.format(
        Locale.ROOT,
        "## [%d] %s (scene %s) %s-%s\nLocation: %s | %s\nMatch: %.2f (%s)\n\n%s\n\n---\n",
        rank,
        result.clipId(),
        result.sceneId(),
        metadata.getOrDefault("start_display", result.start()),
        metadata.getOrDefault("end_display", result.end()),
        metadata.getOrDefault("location", "?"),
        metadata.getOrDefault("time_of_day", "?"),
        result.matchScore(),
        result.confidence().label(),
        result.text());
  }
}
