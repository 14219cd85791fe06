package com.asiainfo.deepdive.infra.persistence;

import com.asiainfo.deepdive.core.model.Perspective;
import com.asiainfo.deepdive.shared.DeepDiveConstants;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于 JDBC 的数据仓库实现（SQLite）
 * 每次调用只查询一个周期，按视角的分组键 GROUP BY
 */
@ApplicationScoped
public class JdbcWarehouseClient implements WarehouseClient {

    private static final Logger log = LoggerFactory.getLogger(JdbcWarehouseClient.class);

    @Inject
    @io.quarkus.agroal.DataSource("warehouse")
    DataSource warehouseDs;

    @Inject
    MeterRegistry registry;

    @Override
    public List<WarehouseRow> queryAggregates(AggregateQuery query) {
        String sql = buildSql(query);
        log.debug("[Warehouse] {} {} SQL: {} params={}", query.perspective().id(), query.range(), sql,
                query.predicate().params());

        Timer.Sample sample = Timer.start(registry);
        String outcome = "success";
        try (Connection conn = warehouseDs.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            int idx = 1;
            stmt.setString(idx++, query.range().start().toString());
            stmt.setString(idx++, query.range().end().toString());
            for (Object param : query.predicate().params()) {
                stmt.setObject(idx++, param);
            }

            List<WarehouseRow> rows = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapRow(rs));
                }
            }
            return rows;

        } catch (SQLException e) {
            outcome = "failure";
            log.error("[Warehouse] Query failed for {} {}: {}", query.perspective().id(), query.range(),
                    e.getMessage(), e);
            throw new DataSourceException(e.getMessage(), e);
        } finally {
            sample.stop(Timer.builder("deepdive.warehouse.query")
                    .tag("perspective", query.perspective().id())
                    .tag("outcome", outcome)
                    .register(registry));
        }
    }

    /**
     * SELECT key, name, SUM(req), SUM(paid), SUM(rev), AVG(cpm), COUNT(DISTINCT child)
     * FROM table WHERE date BETWEEN ? AND ? AND key IS NOT NULL AND (predicate) GROUP BY key
     */
    String buildSql(AggregateQuery query) {
        if (!DeepDiveConstants.SQL_IDENTIFIER.matcher(query.table()).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + query.table());
        }
        Perspective p = query.perspective();
        String key = p.groupingKey();
        String childCount = p.childCountExpression() != null ? p.childCountExpression() : "0";

        StringBuilder sql = new StringBuilder("SELECT ");
        sql.append("CAST(").append(key).append(" AS TEXT) AS entity_id, ");
        sql.append(p.nameExpression()).append(" AS display_name, ");
        sql.append("COALESCE(SUM(req), 0) AS requests, ");
        sql.append("COALESCE(SUM(paid), 0) AS paid, ");
        sql.append("COALESCE(SUM(rev), 0) AS revenue, ");
        sql.append("AVG(CAST(request_cpm AS REAL)) AS avg_cpm, ");
        sql.append(childCount).append(" AS child_count ");
        sql.append("FROM ").append(query.table()).append(" ");
        sql.append("WHERE date >= ? AND date <= ? ");
        sql.append("AND ").append(key).append(" IS NOT NULL");
        if (!query.predicate().isAlwaysTrue()) {
            sql.append(" AND ").append(query.predicate().sql());
        }
        sql.append(" GROUP BY ").append(key);
        return sql.toString();
    }

    private WarehouseRow mapRow(ResultSet rs) throws SQLException {
        double cpm = rs.getDouble("avg_cpm");
        Double avgCpm = rs.wasNull() ? null : cpm;
        return new WarehouseRow(
                rs.getString("entity_id"),
                rs.getString("display_name"),
                rs.getLong("requests"),
                rs.getLong("paid"),
                rs.getDouble("revenue"),
                avgCpm,
                rs.getInt("child_count"));
    }
}
