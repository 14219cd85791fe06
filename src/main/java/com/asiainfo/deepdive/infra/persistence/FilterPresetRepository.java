package com.asiainfo.deepdive.infra.persistence;

import com.asiainfo.deepdive.core.filter.SimplifiedFilter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 过滤预设仓库
 * 负责在 filter_presets 表中保存和查询预设，过滤条件以 JSON 存放在 payload 列
 */
@ApplicationScoped
public class FilterPresetRepository {

    private static final Logger log = LoggerFactory.getLogger(FilterPresetRepository.class);

    @Inject
    @io.quarkus.agroal.DataSource("warehouse")
    DataSource warehouseDs;

    @Inject
    ObjectMapper objectMapper;

    /**
     * payload 列的内容
     */
    public record Payload(Map<String, List<String>> filters, SimplifiedFilter simplifiedFilter) {
    }

    public FilterPreset save(FilterPreset preset) {
        if (preset.name() == null || preset.name().isBlank()) {
            throw new IllegalArgumentException("Preset name is required");
        }
        if (preset.page() == null || preset.page().isBlank()) {
            throw new IllegalArgumentException("Preset page is required");
        }
        FilterPreset stored = preset.withIdentity(UUID.randomUUID().toString(), Instant.now());

        String sql = "INSERT INTO filter_presets "
                + "(id, name, description, page, perspective, is_default, payload, created_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = warehouseDs.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, stored.id());
            stmt.setString(2, stored.name());
            stmt.setString(3, stored.description());
            stmt.setString(4, stored.page());
            stmt.setString(5, stored.perspective());
            stmt.setInt(6, stored.isDefault() ? 1 : 0);
            stmt.setString(7, objectMapper.writeValueAsString(
                    new Payload(stored.filters(), stored.simplifiedFilter())));
            stmt.setString(8, stored.createdAt().toString());
            stmt.executeUpdate();

        } catch (SQLException e) {
            throw new DataSourceException("保存过滤预设失败: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("过滤预设无法序列化: " + e.getOriginalMessage(), e);
        }

        log.info("Saved filter preset {} ({}) for page {}", stored.name(), stored.id(), stored.page());
        return stored;
    }

    public List<FilterPreset> findByPage(String page) {
        String sql = "SELECT * FROM filter_presets WHERE page = ? ORDER BY is_default DESC, created_at";

        try (Connection conn = warehouseDs.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, page);
            List<FilterPreset> result = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }
            return result;

        } catch (SQLException e) {
            throw new DataSourceException("查询过滤预设失败: " + e.getMessage(), e);
        }
    }

    public Optional<FilterPreset> findById(String id) {
        String sql = "SELECT * FROM filter_presets WHERE id = ?";

        try (Connection conn = warehouseDs.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw new DataSourceException("查询过滤预设失败: " + id, e);
        }
    }

    public boolean delete(String id) {
        try (Connection conn = warehouseDs.getConnection();
             PreparedStatement stmt = conn.prepareStatement("DELETE FROM filter_presets WHERE id = ?")) {

            stmt.setString(1, id);
            boolean deleted = stmt.executeUpdate() > 0;
            if (deleted) {
                log.info("Deleted filter preset {}", id);
            }
            return deleted;

        } catch (SQLException e) {
            throw new DataSourceException("删除过滤预设失败: " + id, e);
        }
    }

    private FilterPreset mapRow(ResultSet rs) throws SQLException {
        Payload payload;
        try {
            payload = objectMapper.readValue(rs.getString("payload"), Payload.class);
        } catch (JsonProcessingException e) {
            throw new DataSourceException("过滤预设 payload 损坏: " + rs.getString("id"), e);
        }
        return new FilterPreset(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getString("page"),
                rs.getString("perspective"),
                payload.filters(),
                payload.simplifiedFilter(),
                rs.getInt("is_default") == 1,
                Instant.parse(rs.getString("created_at")));
    }
}
