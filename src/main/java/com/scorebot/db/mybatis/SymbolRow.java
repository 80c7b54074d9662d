package com.scorebot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SymbolRow {
    private String ticker;
    private String sector;
    private String assetType;
}
