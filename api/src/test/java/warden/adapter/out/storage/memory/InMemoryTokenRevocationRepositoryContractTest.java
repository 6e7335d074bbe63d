package warden.adapter.out.storage.memory;

import warden.core.port.out.TokenRevocationRepository;
import warden.core.port.out.TokenRevocationRepositoryContractTest;
import warden.mock.MutableClock;

class InMemoryTokenRevocationRepositoryContractTest extends TokenRevocationRepositoryContractTest {

    @Override
    protected TokenRevocationRepository createRepository(MutableClock clock) {
        return new InMemoryTokenRevocationRepository(clock);
    }
}
