package io.specbridge.core.tools;

import io.specbridge.core.utils.ToolUtils;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a compiled catalog as grouped text, meant to brief a consumer once per session.
 */
@UtilityClass
public class CatalogSummarizer {
    public static final String DEFAULT_TAG = "misc";

    /**
     * One <code>### tag</code> heading per tag, in order of first appearance, each followed by one line per tool:
     * <code>- `name` (METHOD): first line of description</code>. A tool with several tags is listed under each.
     */
    public static String summarize(List<ToolDefinition> tools) {
        final var lines = new ArrayList<String>();
        groupByTag(tools).forEach((tag, tagTools) -> {
            if (!lines.isEmpty()) {
                lines.add("");
            }
            lines.add("### " + tag);
            tagTools.forEach(tool -> lines.add("- `%s` (%s): %s".formatted(tool.getName(),
                                                                         tool.getHttpMethod(),
                                                                         ToolUtils.firstLine(tool.getDescription()))));
        });
        return String.join("\n", lines);
    }

    /**
     * Detailed listing: method and path plus every argument marked required or optional
     */
    public static String describe(List<ToolDefinition> tools) {
        final var lines = new ArrayList<String>();
        groupByTag(tools).forEach((tag, tagTools) -> {
            if (!lines.isEmpty()) {
                lines.add("");
            }
            lines.add("## " + tag);
            tagTools.forEach(tool -> {
                lines.add("* " + tool.getName());
                lines.add("  %s %s".formatted(tool.getHttpMethod(), tool.getPathTemplate()));
                final var description = ToolUtils.firstLine(tool.getDescription());
                if (!description.isEmpty()) {
                    lines.add("  " + description);
                }
                final var arguments = ToolSchemas.arguments(tool)
                        .stream()
                        .map(argument -> "%s(%s)".formatted(argument.getName(),
                                                            argument.isRequired() ? "required" : "optional"))
                        .toList();
                if (!arguments.isEmpty()) {
                    lines.add("  Parameters: " + String.join(", ", arguments));
                }
            });
        });
        return String.join("\n", lines);
    }

    private static Map<String, List<ToolDefinition>> groupByTag(List<ToolDefinition> tools) {
        final var groups = new LinkedHashMap<String, List<ToolDefinition>>();
        tools.forEach(tool -> {
            final var tags = tool.getTags().isEmpty() ? List.of(DEFAULT_TAG) : tool.getTags();
            tags.forEach(tag -> groups.computeIfAbsent(tag, t -> new ArrayList<>()).add(tool));
        });
        return groups;
    }
}
