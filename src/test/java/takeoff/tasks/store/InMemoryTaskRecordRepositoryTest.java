package takeoff.tasks.store;

import org.junit.jupiter.api.BeforeEach;
import takeoff.tasks.repository.TaskRecordRepository;

class InMemoryTaskRecordRepositoryTest extends AbstractTaskRecordRepositoryTest {

    private InMemoryTaskRecordRepository repo;

    @BeforeEach
    void setup() {
        repo = new InMemoryTaskRecordRepository();
    }

    @Override
    protected TaskRecordRepository repo() {
        return repo;
    }
}
