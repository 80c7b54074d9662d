package com.scorebot.db;

import com.scorebot.db.mybatis.MyBatisSupport;
import com.scorebot.db.mybatis.SymbolRow;
import com.scorebot.db.mybatis.UniverseMapper;
import com.scorebot.model.Symbol;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the active symbol universe from the {@code symbols} table.
 */
public final class UniverseDao {
    private final Database database;

    public UniverseDao(Database database) {
        this.database = database;
    }

    public List<Symbol> listActive(int limit) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            List<SymbolRow> rows = session.getMapper(UniverseMapper.class).listActive(Math.max(0, limit));
            List<Symbol> out = new ArrayList<>(rows.size());
            for (SymbolRow row : rows) {
                if (row == null || row.getTicker() == null || row.getTicker().trim().isEmpty()) {
                    continue;
                }
                out.add(toSymbol(row));
            }
            return out;
        }
    }

    public int countActive() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(UniverseMapper.class).countActive();
        }
    }

    static Symbol toSymbol(SymbolRow row) {
        return new Symbol(row.getTicker(), row.getSector(), Symbol.AssetType.fromText(row.getAssetType()));
    }
}
