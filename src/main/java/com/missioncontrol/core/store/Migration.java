package com.missioncontrol.core.store;

import java.util.List;

/**
 * One forward-only schema step. Ids are applied in list order and never reused.
 *
 * @param statements DDL/DML run in order inside one transaction
 */
public record Migration(String id, String name, List<String> statements) {

    public Migration {
        statements = List.copyOf(statements);
    }

    public static Migration of(String id, String name, String... statements) {
        return new Migration(id, name, List.of(statements));
    }
}
