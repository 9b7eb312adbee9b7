package com.chartbot.db;

import com.chartbot.automation.error.PersistenceException;
import com.chartbot.db.mybatis.AccountMapper;
import com.chartbot.db.mybatis.AccountRow;
import com.chartbot.db.mybatis.LayoutRow;
import com.chartbot.db.mybatis.MyBatisSupport;
import com.chartbot.model.Layout;
import com.chartbot.model.UserAccount;
import com.chartbot.store.AccountRepository;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Read-only lookups into the users and layouts tables.
 */
public final class AccountDao implements AccountRepository {
    private final Database database;

    public AccountDao(Database database) {
        this.database = database;
    }

    @Override
    public Optional<Layout> findLayout(String layoutId) throws PersistenceException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            LayoutRow row = session.getMapper(AccountMapper.class).selectLayout(layoutId);
            if (row == null) {
                return Optional.empty();
            }
            return Optional.of(new Layout(row.getId(), row.getUserId(), row.getCaptureTargetId(), row.getSymbol(),
                    row.getChartInterval()));
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("select layout " + layoutId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<UserAccount> findAccount(String userId) throws PersistenceException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            AccountRow row = session.getMapper(AccountMapper.class).selectAccount(userId);
            if (row == null) {
                return Optional.empty();
            }
            // Unset preferences default to the richer alert.
            return Optional.of(new UserAccount(
                    row.getId(),
                    row.getTvSessionId(),
                    row.getTvSessionIdSign(),
                    row.getTelegramChatId(),
                    row.getTelegramIncludeChart() == null || row.getTelegramIncludeChart(),
                    row.getTelegramIncludeEconomic() == null || row.getTelegramIncludeEconomic(),
                    row.getPreferredModel()
            ));
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("select account " + userId + " failed: " + e.getMessage(), e);
        }
    }
}
