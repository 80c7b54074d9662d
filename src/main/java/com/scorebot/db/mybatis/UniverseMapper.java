package com.scorebot.db.mybatis;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface UniverseMapper {
    @Select({
            "<script>",
            "SELECT ticker, sector, asset_type FROM symbols WHERE active=TRUE ORDER BY ticker ASC",
            "<if test='limit &gt; 0'> LIMIT #{limit}</if>",
            "</script>"
    })
    List<SymbolRow> listActive(@Param("limit") int limit);

    @Select("SELECT COUNT(*) FROM symbols WHERE active=TRUE")
    int countActive();
}
