package com.phillippitts.insightbot.service.settings;

import com.phillippitts.insightbot.domain.AnalysisMode;
import com.phillippitts.insightbot.domain.GuildId;
import com.phillippitts.insightbot.domain.GuildSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Objects;

/**
 * {@link GuildSettingsStore} over the {@code guild_settings} table.
 *
 * <p>Writes upsert a single column, so a guild's row is created on its first write with
 * column defaults for everything else. Stored values that no longer parse fall back to defaults.
 */
@Repository
public class JdbcGuildSettingsStore implements GuildSettingsStore {

    private static final Logger LOG = LogManager.getLogger(JdbcGuildSettingsStore.class);

    private static final String SELECT_SQL =
            "SELECT api_key, analysis_mode, recording_interval FROM guild_settings WHERE guild_id = ?";

    private static final RowMapper<GuildSettings> ROW_MAPPER = (rs, rowNum) -> {
        String mode = rs.getString("analysis_mode");
        int interval = rs.getInt("recording_interval");
        if (rs.wasNull() || interval <= 0) {
            interval = GuildSettings.DEFAULT_INTERVAL_SECONDS;
        }
        return new GuildSettings(
                AnalysisMode.parseOrDefault(mode, GuildSettings.DEFAULT_MODE),
                interval,
                rs.getString("api_key"));
    };

    private final JdbcTemplate jdbcTemplate;

    public JdbcGuildSettingsStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate);
    }

    @Override
    public GuildSettings get(GuildId guildId) {
        Objects.requireNonNull(guildId, "guildId must not be null");
        List<GuildSettings> rows = jdbcTemplate.query(SELECT_SQL, ROW_MAPPER, guildId.value());
        return rows.isEmpty() ? GuildSettings.defaults() : rows.get(0);
    }

    @Override
    public void set(GuildId guildId, SettingKey key, String value) {
        Objects.requireNonNull(guildId, "guildId must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Object normalized = SettingValues.normalize(key, value);
        jdbcTemplate.update(
                "MERGE INTO guild_settings (guild_id, " + key.column() + ") KEY (guild_id) VALUES (?, ?)",
                guildId.value(), normalized);
        LOG.info("Guild setting updated: guild={}, setting={}", guildId, key.column());
    }
}
