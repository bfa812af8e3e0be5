package org.crawljav;

import org.junit.jupiter.api.extension.*;

/**
 * Shares one in-memory catalog between test classes and empties it before every test.
 */
public class InMemoryDatabaseTestExtension implements BeforeAllCallback, AfterAllCallback, BeforeEachCallback,
        ParameterResolver {

    private static Database sharedDatabase;

    @Override
    public void beforeAll(ExtensionContext context) {
        if (sharedDatabase == null) {
            sharedDatabase = Database.inMemory();
        }
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        sharedDatabase.useHandle(handle -> {
            handle.execute("DELETE FROM magnets");
            handle.execute("DELETE FROM works");
            handle.execute("DELETE FROM actors");
        });
    }

    @Override
    public void afterAll(ExtensionContext context) {
        if (sharedDatabase != null && !isSharedWithOtherContexts(context)) {
            sharedDatabase.close();
            sharedDatabase = null;
        }
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        Class<?> type = parameterContext.getParameter().getType();
        return type == Database.class || type == Catalog.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        if (parameterContext.getParameter().getType() == Catalog.class) {
            return new Catalog(sharedDatabase);
        }
        return sharedDatabase;
    }

    private boolean isSharedWithOtherContexts(ExtensionContext context) {
        return context.getRoot().getStore(ExtensionContext.Namespace.GLOBAL)
                       .get(Database.class.getName()) != null;
    }
}
