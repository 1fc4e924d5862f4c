package com.cgi.dataprofiler.engine.core.backend;

import com.cgi.dataprofiler.engine.core.chunk.BackendType;
import com.cgi.dataprofiler.engine.core.chunk.Chunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Factory resolving the backend adapter of a chunk.
 * Resolution happens once per profiling run, from the first chunk.
 */
@Component
public class BackendAdapterFactory {
    private static final Logger logger = LoggerFactory.getLogger(BackendAdapterFactory.class);

    /**
     * Map of backend types to adapters.
     */
    private final Map<BackendType, BackendAdapter> adapters = new EnumMap<>(BackendType.class);

    /**
     * Constructor.
     * Finds all adapters with the @ChunkBackend annotation.
     *
     * @param applicationContext Spring application context
     */
    @Autowired
    public BackendAdapterFactory(ApplicationContext applicationContext) {
        this(applicationContext.getBeansOfType(BackendAdapter.class).values());
    }

    /**
     * Constructor for an explicit set of adapters.
     *
     * @param candidates Adapters to register
     */
    public BackendAdapterFactory(Collection<? extends BackendAdapter> candidates) {
        for (BackendAdapter adapter : candidates) {
            ChunkBackend annotation = adapter.getClass().getAnnotation(ChunkBackend.class);
            if (annotation == null) {
                logger.warn("Ignoring backend adapter without @ChunkBackend: {}", adapter.getClass().getName());
                continue;
            }
            adapters.put(annotation.value(), adapter);
        }

        logger.info("Registered backend adapters: {}", adapters.keySet());
    }

    /**
     * Gets the adapter able to read the given chunk.
     *
     * @param chunk Chunk to read
     * @return Backend adapter
     */
    public BackendAdapter getAdapter(Chunk chunk) {
        return getAdapter(chunk.getBackendType());
    }

    /**
     * Gets the adapter for a backend type.
     *
     * @param backendType Backend type
     * @return Backend adapter
     */
    public BackendAdapter getAdapter(BackendType backendType) {
        BackendAdapter adapter = adapters.get(backendType);
        if (adapter == null) {
            throw new IllegalArgumentException("Unsupported backend: " + backendType);
        }
        logger.debug("Resolved adapter {} for backend {}", adapter.getClass().getSimpleName(), backendType);
        return adapter;
    }

    /**
     * Gets the list of supported backends.
     *
     * @return Supported backend types
     */
    public List<BackendType> getSupportedBackends() {
        return List.copyOf(adapters.keySet());
    }
}
