package com.scheduler.engine.persistence;

import org.junit.jupiter.api.DisplayName;

@DisplayName("In-memory registry")
class InMemoryRegistryTest extends RegistryContract {

    @Override
    protected Stores createStores() {
        InMemoryDependencyRepository dependencies = new InMemoryDependencyRepository();
        return new Stores(
            new InMemoryTaskRepository(dependencies),
            new InMemoryTaskRunRepository(),
            new InMemoryWorkerRepository(),
            dependencies
        );
    }
}
