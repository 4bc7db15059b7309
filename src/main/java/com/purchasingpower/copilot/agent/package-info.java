/**
 * Query orchestration over independent information sources.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code ToolOrchestrator} - fan-out to the source tools and fan-in of their outputs</li>
 *   <li>{@code Tool} - contract every source implements, with its {@code ToolCategory}</li>
 *   <li>{@code ResponseFuser} - merges informative outputs into the final answer</li>
 *   <li>{@code OrchestrationListener} - progress callbacks for streaming</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.copilot.agent;
