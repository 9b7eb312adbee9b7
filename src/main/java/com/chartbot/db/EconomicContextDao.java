package com.chartbot.db;

import com.chartbot.automation.error.PersistenceException;
import com.chartbot.db.mybatis.EconomicContextMapper;
import com.chartbot.db.mybatis.EconomicContextRow;
import com.chartbot.db.mybatis.MyBatisSupport;
import com.chartbot.model.EconomicContext;
import com.chartbot.model.RiskLevel;
import com.chartbot.model.WeeklyOutlook;
import com.chartbot.store.EconomicContextRepository;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

import static com.chartbot.db.RowCodec.instant;
import static com.chartbot.db.RowCodec.utc;

public final class EconomicContextDao implements EconomicContextRepository {
    private final Database database;

    public EconomicContextDao(Database database) {
        this.database = database;
    }

    @Override
    public EconomicContext upsert(EconomicContext context) throws PersistenceException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            EconomicContextRow row = EconomicContextRow.builder()
                    .signalId(context.signalId)
                    .symbol(context.symbol)
                    .immediateRisk(context.immediateRisk.name())
                    .weeklyOutlook(context.weeklyOutlook.name())
                    .impactSummary(context.impactSummary == null ? "" : context.impactSummary)
                    .warningsJson(RowCodec.stringsToJson(context.warnings))
                    .opportunitiesJson(RowCodec.stringsToJson(context.opportunities))
                    .recommendation(context.recommendation == null ? "" : context.recommendation)
                    .upcomingEventsJson(RowCodec.eventsToJson(context.upcomingEvents))
                    .weeklyEventsJson(RowCodec.eventsToJson(context.weeklyEvents))
                    .createdAt(utc(context.createdAt == null ? Instant.now() : context.createdAt))
                    .build();
            session.getMapper(EconomicContextMapper.class).upsert(row);
            conn.commit();
            return context.toBuilder().id(row.getId()).build();
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("upsert economic context for signal " + context.signalId
                    + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<EconomicContext> findBySignalId(long signalId) throws PersistenceException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            EconomicContextRow row = session.getMapper(EconomicContextMapper.class).selectBySignalId(signalId);
            if (row == null) {
                return Optional.empty();
            }
            return Optional.of(EconomicContext.builder()
                    .id(row.getId())
                    .signalId(row.getSignalId())
                    .symbol(row.getSymbol())
                    .immediateRisk(RiskLevel.fromLabel(row.getImmediateRisk()))
                    .weeklyOutlook(WeeklyOutlook.fromLabel(row.getWeeklyOutlook()))
                    .impactSummary(row.getImpactSummary())
                    .warnings(RowCodec.jsonToStrings(row.getWarningsJson()))
                    .opportunities(RowCodec.jsonToStrings(row.getOpportunitiesJson()))
                    .recommendation(row.getRecommendation())
                    .upcomingEvents(RowCodec.jsonToEvents(row.getUpcomingEventsJson()))
                    .weeklyEvents(RowCodec.jsonToEvents(row.getWeeklyEventsJson()))
                    .createdAt(instant(row.getCreatedAt()))
                    .build());
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("select economic context for signal " + signalId
                    + " failed: " + e.getMessage(), e);
        }
    }
}
