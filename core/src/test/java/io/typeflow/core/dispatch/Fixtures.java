package io.typeflow.core.dispatch;

import io.typeflow.core.schema.ClassBuilder;
import io.typeflow.core.schema.EnumBuilder;
import io.typeflow.core.schema.SchemaRegistry;
import io.typeflow.core.schema.SchemaSnapshot;

/** Shared schema for dispatch tests. */
final class Fixtures {

    private Fixtures() {}

    static SchemaRegistry registry() {
        SchemaRegistry registry = new SchemaRegistry();
        ClassBuilder user = registry.defineClass("User");
        user.property("name").type("string");
        user.property("age").type("int?");

        EnumBuilder status = registry.defineEnum("Status");
        status.value("ACTIVE");
        status.value("INACTIVE");
        ClassBuilder account = registry.defineClass("Account");
        account.property("owner").type("string");
        account.property("status").type("Status");
        return registry;
    }

    static SchemaSnapshot schema() {
        return registry().snapshot();
    }
}
