package com.cgi.dataprofiler.engine.core.backend;

import com.cgi.dataprofiler.engine.core.chunk.BackendType;

import java.lang.annotation.*;

/**
 * Annotation to mark a BackendAdapter implementation with the engine it reads.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ChunkBackend {
    /**
     * The backend type handled by the annotated adapter.
     */
    BackendType value();
}
