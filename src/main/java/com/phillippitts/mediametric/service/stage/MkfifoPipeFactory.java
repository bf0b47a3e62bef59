package com.phillippitts.mediametric.service.stage;

import com.phillippitts.mediametric.service.process.ExecutableLocator;
import com.phillippitts.mediametric.service.process.ProcessRunner;
import com.phillippitts.mediametric.util.ProcessTimeouts;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * {@link PipeFactory} that shells out to {@code mkfifo}.
 */
public final class MkfifoPipeFactory implements PipeFactory {

    private static final String MKFIFO = "mkfifo";
    private static final int MAX_CAPTURE = 4096;

    private final ProcessRunner processRunner;

    public MkfifoPipeFactory(ProcessRunner processRunner) {
        this.processRunner = Objects.requireNonNull(processRunner, "processRunner");
    }

    @Override
    public void create(Path path) {
        processRunner.run(List.of(MKFIFO, path.toString()), MKFIFO, ProcessTimeouts.HELPER_TOOL_TIMEOUT,
                MAX_CAPTURE);
    }

    @Override
    public boolean isAvailable() {
        return ExecutableLocator.isAvailable(MKFIFO);
    }

    @Override
    public String name() {
        return MKFIFO;
    }
}
