package io.caretaker.core.history;

import java.io.IOException;
import java.util.List;

public interface JobHistoryStore {
    List<JobRunRecord> load() throws IOException;

    void save(List<JobRunRecord> records) throws IOException;
}
