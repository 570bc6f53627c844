package org.gamma.imgbatch.config;

import java.util.List;

public record AppConfig(List<BatchJobItem> batchJobs) {
}
