package io.github.eutro.funclets.api;

import io.github.eutro.funclets.bytecode.ByteInputStream;
import io.github.eutro.funclets.validate.FunctionBodyValidator;
import io.github.eutro.funclets.validate.ValidatedBody;
import io.github.eutro.funclets.validate.ValidationException;
import io.github.eutro.funclets.validate.ValidatorOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.github.eutro.funclets.validate.ValidationException.Kind.MALFORMED_ENCODING;

/**
 * Validates the bodies of a module in parallel.
 * <p>
 * Each body gets its own {@link FunctionBodyValidator}; the only state they share is the immutable
 * module, so the failure of one body has no effect on the others.
 */
public class ModuleValidator {
    private static final Logger LOGGER = Logger.getLogger(ModuleValidator.class.getName());

    private final ValidatorOptions options;
    private final int parallelism;

    public ModuleValidator(ValidatorOptions options, int parallelism) {
        if (parallelism <= 0) throw new IllegalArgumentException("parallelism: " + parallelism);
        this.options = options;
        this.parallelism = parallelism;
    }

    public ModuleValidator() {
        this(ValidatorOptions.DEFAULT, Runtime.getRuntime().availableProcessors());
    }

    public int getParallelism() {
        return parallelism;
    }

    public ModuleValidation validate(byte[] bytes) throws ValidationException, InterruptedException {
        return validate(ModuleReader.read(bytes));
    }

    /**
     * Validate every body of a module on a pool of {@link #getParallelism()} threads.
     *
     * @param module The module.
     * @return The results.
     * @throws InterruptedException If interrupted while waiting for the bodies.
     */
    public ModuleValidation validate(ModuleReader.ModuleContents module) throws InterruptedException {
        AtomicInteger threadId = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "funclets-validator-" + threadId.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        try {
            return validate(module, pool);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Validate every body of a module on the given executor.
     *
     * @param module   The module.
     * @param executor The executor, which is not shut down.
     * @return The results.
     * @throws InterruptedException If interrupted while waiting for the bodies.
     */
    public ModuleValidation validate(ModuleReader.ModuleContents module, ExecutorService executor)
            throws InterruptedException {
        List<Future<BodyResult>> futures = new ArrayList<>();
        for (ModuleReader.CodeBody body : module.bodies) {
            futures.add(executor.submit(() -> validateBody(module, body, options)));
        }
        List<BodyResult> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                // validateBody catches everything but Errors
                results.add(BodyResult.failure(module.bodies.get(i).funcIndex, e.getCause()));
            }
        }
        ModuleValidation validation = new ModuleValidation(module, results);
        int failed = validation.failures().size();
        if (failed == 0) {
            LOGGER.info("validated " + results.size() + " function bodies");
        } else {
            LOGGER.warning(failed + " of " + results.size() + " function bodies failed validation");
        }
        return validation;
    }

    public static BodyResult validateBody(ModuleReader.ModuleContents module,
                                          ModuleReader.CodeBody body,
                                          ValidatorOptions options) {
        try {
            ByteInputStream in = module.open(body);
            ValidatedBody validated = FunctionBodyValidator.validate(in, module.ctx, body.funcIndex, options);
            if (in.hasMore()) {
                throw new ValidationException(MALFORMED_ENCODING, in.position(),
                        in.remaining() + " trailing bytes after function body");
            }
            return BodyResult.success(validated);
        } catch (ValidationException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("function " + body.funcIndex + " rejected: " + e.getMessage());
            }
            return BodyResult.failure(body.funcIndex, e);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "internal error validating function " + body.funcIndex, e);
            return BodyResult.failure(body.funcIndex, e);
        }
    }
}
