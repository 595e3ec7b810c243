package com.ylm.attendance.payroll.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ylm.attendance.payroll.config.PayrollProperties;
import com.ylm.attendance.payroll.dto.StoredSalaryReport;
import com.ylm.attendance.payroll.exception.ReportStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Keeps the latest salary report as a JSON file. Writes go to a temporary file in the same
 * directory which then replaces the target, so readers never see a partial report.
 */
@Repository
public class SalaryReportStore {

    private static final Logger logger = LoggerFactory.getLogger(SalaryReportStore.class);

    private final ObjectMapper mapper;
    private final Path reportPath;

    @Autowired
    public SalaryReportStore(ObjectMapper mapper, PayrollProperties properties) {
        this(mapper, Path.of(properties.getStorage().getReportPath()));
    }

    public SalaryReportStore(ObjectMapper mapper, Path reportPath) {
        this.mapper = mapper;
        this.reportPath = reportPath.toAbsolutePath();
    }

    public synchronized void save(StoredSalaryReport report) {
        Path dir = reportPath.getParent();
        Path temp = null;
        try {
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, reportPath.getFileName().toString(), ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), report);
            try {
                Files.move(temp, reportPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.warn("Atomic move not supported in {}, replacing report non-atomically", dir);
                Files.move(temp, reportPath, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.info("Atomic write completed: {}", reportPath);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new ReportStorageException("Failed to write salary report to " + reportPath, e);
        }
    }

    public synchronized Optional<StoredSalaryReport> load() {
        if (!Files.exists(reportPath)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(reportPath.toFile(), StoredSalaryReport.class));
        } catch (IOException e) {
            logger.error("Error reading salary data from {}: {}", reportPath, e.getMessage());
            throw new ReportStorageException("Failed to read salary report from " + reportPath, e);
        }
    }

    public Path getReportPath() {
        return reportPath;
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary report file {}: {}", temp, e.getMessage());
        }
    }
}
