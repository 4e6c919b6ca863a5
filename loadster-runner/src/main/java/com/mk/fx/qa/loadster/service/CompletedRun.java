package com.mk.fx.qa.loadster.service;

import com.mk.fx.qa.loadster.dto.LoadTestRunReport;
import com.mk.fx.qa.loadster.model.Sample;
import java.util.List;

/**
 * A finished run: its raw samples and its report.
 *
 * @param samples samples of the completed calls
 * @param report the run report
 */
public record CompletedRun(List<Sample> samples, LoadTestRunReport report) {}
