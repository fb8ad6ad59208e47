package com.edge.dia.service;

import com.edge.dia.config.DiaProperties;
import com.edge.dia.core.pipeline.FailureReason;
import com.edge.dia.dto.BatchRequest;
import com.edge.dia.dto.BatchResponse;
import com.edge.dia.dto.ProcessRequest;
import com.edge.dia.exception.InputException;
import com.edge.dia.io.RunReport;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 批量处理服务
 * <p>
 * 各图像对在固定大小的工作线程池中独立运行，互不共享可变数据。
 * 单个图像对失败只影响它自己的报告。
 */
@Service
public class BatchDiaService {
    private static final Logger logger = LoggerFactory.getLogger(BatchDiaService.class);

    private static final List<String> FITS_EXTENSIONS = List.of(".fits", ".fit", ".fts");

    @Autowired
    private DiaService diaService;

    @Autowired
    private DiaProperties properties;

    private ExecutorService workers;

    @PostConstruct
    public void start() {
        int threads = properties.getBatch().getWorkerThreads();
        AtomicInteger counter = new AtomicInteger();
        workers = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "DIA-Worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        logger.info("Batch worker pool started with {} threads", threads);
    }

    public BatchResponse process(BatchRequest request) {
        List<ProcessRequest> pairs = resolvePairs(request);
        if (pairs.isEmpty()) {
            throw new InputException("Batch request contains no image pairs");
        }
        long start = System.currentTimeMillis();
        logger.info("Starting batch of {} pairs", pairs.size());

        List<ProcessRequest> jobs = assignOutputs(pairs, request.getOutputDirectory());
        List<Future<RunReport>> futures = new ArrayList<>(jobs.size());
        for (ProcessRequest job : jobs) {
            futures.add(workers.submit(() -> diaService.process(job)));
        }

        long timeout = properties.getBatch().getPairTimeoutSeconds();
        List<RunReport> reports = new ArrayList<>(jobs.size());
        for (int i = 0; i < futures.size(); i++) {
            reports.add(await(futures.get(i), jobs.get(i), timeout));
        }

        BatchResponse response = BatchResponse.of(reports, System.currentTimeMillis() - start);
        logger.info("Batch finished: {} succeeded, {} failed, {} ms",
            response.getSucceeded(), response.getFailed(), response.getElapsedMillis());
        return response;
    }

    /**
     * 复制每个请求并确定输出目录与文件名前缀
     * <p>
     * 同一输出目录下前缀重复时依次加 _2、_3 后缀，保证各图像对的输出文件互不覆盖。
     */
    List<ProcessRequest> assignOutputs(List<ProcessRequest> pairs, String batchOutputDirectory) {
        List<ProcessRequest> jobs = new ArrayList<>(pairs.size());
        Set<String> taken = new HashSet<>();
        for (ProcessRequest pair : pairs) {
            ProcessRequest job = pair.copy();
            if (isBlank(job.getOutputDirectory()) && !isBlank(batchOutputDirectory)) {
                job.setOutputDirectory(batchOutputDirectory);
            }
            String directory = isBlank(job.getOutputDirectory())
                ? properties.getOutput().getDirectory() : job.getOutputDirectory();
            String base = isBlank(job.getOutputName()) ? DiaService.stem(job.sourcePath(), null) : job.getOutputName();
            if (base != null) {
                Path dir = Paths.get(directory).toAbsolutePath().normalize();
                String name = base;
                for (int suffix = 2; !taken.add(dir.resolve(name).toString()); suffix++) {
                    name = base + "_" + suffix;
                }
                if (!name.equals(base)) {
                    logger.warn("Output name {} already used in this batch, writing {} as {}", base, job.sourcePath(), name);
                }
                job.setOutputName(name);
            }
            jobs.add(job);
        }
        return jobs;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private RunReport await(Future<RunReport> future, ProcessRequest pair, long timeoutSeconds) {
        String label = pair.getSciencePath() != null ? pair.getSciencePath() : pair.getDifferencePath();
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.error("Pair {} timed out after {} s", label, timeoutSeconds);
            return failed(pair, FailureReason.INTERNAL_ERROR, "Timed out after " + timeoutSeconds + " s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Pair {} failed", label, cause);
            FailureReason reason = cause instanceof InputException ? FailureReason.INPUT_ERROR : FailureReason.INTERNAL_ERROR;
            return failed(pair, reason, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failed(pair, FailureReason.INTERNAL_ERROR, "Interrupted");
        }
    }

    private static RunReport failed(ProcessRequest pair, FailureReason reason, String message) {
        RunReport report = RunReport.failure("-", reason, message);
        report.setReferencePath(pair.getReferencePath());
        report.setSciencePath(pair.getSciencePath() != null ? pair.getSciencePath() : pair.getDifferencePath());
        return report;
    }

    /**
     * 显式列出的图像对在前，目录配对的图像对按文件名排序追加
     */
    List<ProcessRequest> resolvePairs(BatchRequest request) {
        List<ProcessRequest> pairs = new ArrayList<>();
        if (request.getPairs() != null) {
            pairs.addAll(request.getPairs());
        }
        if (request.getReferenceDirectory() != null && request.getScienceDirectory() != null) {
            pairs.addAll(pairDirectories(Paths.get(request.getReferenceDirectory()), Paths.get(request.getScienceDirectory())));
        }
        return pairs;
    }

    private List<ProcessRequest> pairDirectories(Path referenceDir, Path scienceDir) {
        if (!Files.isDirectory(referenceDir) || !Files.isDirectory(scienceDir)) {
            throw new InputException("Batch directories must exist: " + referenceDir + ", " + scienceDir);
        }
        List<Path> scienceFiles;
        try (Stream<Path> stream = Files.list(scienceDir)) {
            scienceFiles = stream.filter(BatchDiaService::isFits).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new InputException("Cannot list science directory " + scienceDir + ": " + e.getMessage(), e);
        }

        List<ProcessRequest> pairs = new ArrayList<>();
        for (Path science : scienceFiles) {
            Path reference = referenceDir.resolve(science.getFileName().toString());
            if (!Files.isRegularFile(reference)) {
                logger.warn("No reference image for {}, skipped", science.getFileName());
                continue;
            }
            pairs.add(ProcessRequest.of(reference.toString(), science.toString()));
        }
        logger.info("Paired {} of {} science images with references", pairs.size(), scienceFiles.size());
        return pairs;
    }

    private static boolean isFits(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return Files.isRegularFile(path) && FITS_EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    @PreDestroy
    public void stop() {
        if (workers == null) {
            return;
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        workers = null;
        logger.info("Batch worker pool stopped");
    }
}
