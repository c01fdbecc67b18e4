package com.project.image.selection.config;

import com.project.image.selection.floodfill.FloodFillEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the flood-fill engine. Tile size only changes how the parallel fills split the work, never
 * the resulting mask.
 */
@Configuration
public class FloodFillConfig {
    private static final Logger log = LoggerFactory.getLogger(FloodFillConfig.class);

    @Bean(destroyMethod = "shutdown")
    public ExecutorService floodFillExecutor(@Value("${app.selection.worker-threads:0}") int workerThreads) {
        int threads = workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
        log.info("Flood fill executor with {} threads", threads);
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("flood-fill-"));
    }

    @Bean
    public FloodFillEngine floodFillEngine(ExecutorService floodFillExecutor,
                                           @Value("${app.selection.tile-width:64}") int tileWidth,
                                           @Value("${app.selection.tile-height:64}") int tileHeight) {
        log.info("Parallel fills use {}x{} tiles", tileWidth, tileHeight);
        return new FloodFillEngine(tileWidth, tileHeight, floodFillExecutor);
    }
}
