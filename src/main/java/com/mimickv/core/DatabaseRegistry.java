package com.mimickv.core;

/**
 * Fixed set of numbered databases, selected per connection with SELECT.
 */
public class DatabaseRegistry {

    public static final int DEFAULT_DATABASES = 16;

    private final Database[] databases;

    public DatabaseRegistry() {
        this(DEFAULT_DATABASES);
    }

    public DatabaseRegistry(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("Database count must be positive: " + count);
        }
        this.databases = new Database[count];
        for (int i = 0; i < count; i++) {
            databases[i] = new Database(i);
        }
    }

    /**
     * @throws CommandException if the index is out of range
     */
    public Database get(int index) {
        if (index < 0 || index >= databases.length) {
            throw new CommandException(ErrorMessages.INVALID_DB_INDEX);
        }
        return databases[index];
    }

    public int size() {
        return databases.length;
    }

    public void flushAll() {
        for (Database db : databases) {
            db.execute(() -> {
                db.flush();
                return null;
            });
        }
    }
}
