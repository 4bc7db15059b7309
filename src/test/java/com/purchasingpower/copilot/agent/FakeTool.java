package com.purchasingpower.copilot.agent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scripted source tool for tests. Records every input it receives.
 */
public class FakeTool implements Tool {

    @FunctionalInterface
    public interface Behavior {
        ToolResult apply(String input) throws Exception;
    }

    private final ToolCategory category;
    private final Behavior behavior;
    private final List<String> inputs = Collections.synchronizedList(new ArrayList<>());

    public FakeTool(ToolCategory category, Behavior behavior) {
        this.category = category;
        this.behavior = behavior;
    }

    public static FakeTool returning(ToolCategory category, String text) {
        return new FakeTool(category, input -> ToolResult.of(text));
    }

    public static FakeTool returning(ToolCategory category, ToolResult result) {
        return new FakeTool(category, input -> result);
    }

    public static FakeTool failing(ToolCategory category, Exception failure) {
        return new FakeTool(category, input -> {
            throw failure;
        });
    }

    @Override
    public ToolCategory getCategory() {
        return category;
    }

    @Override
    public String getDescription() {
        return "Fake " + category.getToolId();
    }

    @Override
    public ToolResult execute(String input) throws Exception {
        inputs.add(input);
        return behavior.apply(input);
    }

    public List<String> getInputs() {
        return List.copyOf(inputs);
    }
}
