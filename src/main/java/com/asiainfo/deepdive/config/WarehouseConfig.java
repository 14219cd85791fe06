package com.asiainfo.deepdive.config;

import io.agroal.api.AgroalDataSource;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * 数据仓库配置类
 * 启动时验证 SQLite 连接，并按需创建事实表与过滤预设表
 */
@ApplicationScoped
public class WarehouseConfig {

    private static final Logger log = LoggerFactory.getLogger(WarehouseConfig.class);

    @Inject
    @io.quarkus.agroal.DataSource("warehouse")
    AgroalDataSource warehouseDataSource;

    @Inject
    DeepDiveConfig config;

    void onStart(@Observes StartupEvent event) {
        try (Connection conn = warehouseDataSource.getConnection();
             Statement stmt = conn.createStatement()) {

            try (ResultSet rs = stmt.executeQuery("SELECT sqlite_version()")) {
                if (rs.next()) {
                    log.info("SQLite 版本: {}", rs.getString(1));
                }
            }

            if (config.isInitSchema()) {
                createSchema(stmt, config.getWarehouseTable());
                log.info("数据仓库表结构已就绪: {}", config.getWarehouseTable());
            }

        } catch (SQLException e) {
            log.error("数据仓库初始化失败", e);
            throw new IllegalStateException("数据仓库初始化失败", e);
        }
    }

    /**
     * 事实表：按日、按 zone 粒度的广告指标；team/pic/pid/mid/product 为上级维度列
     */
    public static void createSchema(Statement stmt, String table) throws SQLException {
        stmt.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
                + "date TEXT NOT NULL, "
                + "year INTEGER, "
                + "month INTEGER, "
                + "team TEXT, "
                + "pic TEXT, "
                + "pid INTEGER, "
                + "pubname TEXT, "
                + "mid INTEGER, "
                + "medianame TEXT, "
                + "zid INTEGER, "
                + "zonename TEXT, "
                + "product TEXT, "
                + "h5 TEXT, "
                + "rev_flag TEXT, "
                + "req INTEGER, "
                + "paid INTEGER, "
                + "rev REAL, "
                + "request_cpm REAL)");
        stmt.execute("CREATE INDEX IF NOT EXISTS idx_" + table + "_date ON " + table + " (date)");

        stmt.execute("CREATE TABLE IF NOT EXISTS filter_presets ("
                + "id TEXT PRIMARY KEY, "
                + "name TEXT NOT NULL, "
                + "description TEXT, "
                + "page TEXT NOT NULL, "
                + "perspective TEXT, "
                + "is_default INTEGER NOT NULL DEFAULT 0, "
                + "payload TEXT NOT NULL, "
                + "created_at TEXT NOT NULL)");
    }
}
