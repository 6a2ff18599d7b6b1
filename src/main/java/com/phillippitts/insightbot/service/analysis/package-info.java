/**
 * Analysis backend boundary.
 *
 * <p>{@link com.phillippitts.insightbot.service.analysis.AnalysisInvoker} is the capability the
 * session engine depends on; {@link com.phillippitts.insightbot.service.analysis.GeminiAnalysisInvoker}
 * implements it over the Gemini REST API with the prompts in
 * {@link com.phillippitts.insightbot.service.analysis.AnalysisPrompts}.
 */
package com.phillippitts.insightbot.service.analysis;
