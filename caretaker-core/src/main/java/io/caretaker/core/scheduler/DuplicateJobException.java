package io.caretaker.core.scheduler;

public class DuplicateJobException extends IllegalArgumentException {

    public DuplicateJobException(String name) {
        super("job already registered: " + name);
    }
}
