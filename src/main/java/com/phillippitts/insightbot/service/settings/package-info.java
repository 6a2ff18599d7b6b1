/**
 * Per-guild settings persistence (analysis mode, interval, API key).
 */
package com.phillippitts.insightbot.service.settings;
