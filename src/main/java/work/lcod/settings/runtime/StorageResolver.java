package work.lcod.settings.runtime;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the reader or writer for one operation and runs it.
 * <p>
 * Reads: variable reader, then registry default reader, then the environment. Exactly one source is
 * consulted per read; an absent result from a variable reader does not fall through to the default reader.
 * Writes: variable writer, then registry default writer, otherwise {@link ReadOnlyException}.
 */
public final class StorageResolver {
    private static final Logger LOG = LoggerFactory.getLogger(StorageResolver.class);

    private final EnvironmentSource environment;
    private volatile SettingsReader defaultReader;
    private volatile SettingsWriter defaultWriter;

    public StorageResolver(EnvironmentSource environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    public void setDefaultReader(SettingsReader reader) {
        Objects.requireNonNull(reader, "reader");
        if (defaultReader != null) {
            LOG.debug("Replacing registry default reader");
        }
        this.defaultReader = reader;
    }

    public void setDefaultWriter(SettingsWriter writer) {
        Objects.requireNonNull(writer, "writer");
        if (defaultWriter != null) {
            LOG.debug("Replacing registry default writer");
        }
        this.defaultWriter = writer;
    }

    public boolean hasDefaultReader() {
        return defaultReader != null;
    }

    public boolean hasDefaultWriter() {
        return defaultWriter != null;
    }

    public Object read(VariableSpec spec) {
        if (spec.reader().isPresent()) {
            LOG.debug("Reading {} through its own reader", spec.name());
            return spec.reader().get().read(spec.storageKey(), spec);
        }
        SettingsReader fallback = defaultReader;
        if (fallback != null) {
            LOG.debug("Reading {} through the registry default reader", spec.name());
            return fallback.read(spec.storageKey(), spec);
        }
        return environment.lookup(spec.storageKey());
    }

    /**
     * True when {@link #write(VariableSpec, Object)} would reach a writer.
     */
    public boolean isWritable(VariableSpec spec) {
        return spec.writer().isPresent() || defaultWriter != null;
    }

    public void write(VariableSpec spec, Object value) {
        if (spec.writer().isPresent()) {
            LOG.debug("Writing {} through its own writer", spec.name());
            spec.writer().get().write(spec.storageKey(), value, spec);
            return;
        }
        SettingsWriter fallback = defaultWriter;
        if (fallback != null) {
            LOG.debug("Writing {} through the registry default writer", spec.name());
            fallback.write(spec.storageKey(), value, spec);
            return;
        }
        throw new ReadOnlyException(spec.name());
    }
}
