package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.domain.AnalysisMode;
import com.phillippitts.insightbot.domain.CycleTrigger;
import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.service.audio.AudioAccumulator;
import com.phillippitts.insightbot.service.publish.PublishTarget;

/**
 * Inputs of one analysis cycle, captured by the session under its cycle lock.
 */
record CycleRequest(GuildId guildId,
                    AudioAccumulator accumulator,
                    PublishTarget target,
                    String sessionStamp,
                    String context,
                    AnalysisMode mode,
                    String credential,
                    CycleTrigger trigger) {
}
