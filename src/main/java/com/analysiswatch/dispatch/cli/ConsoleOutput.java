package com.analysiswatch.dispatch.cli;

import com.analysiswatch.core.model.AnalysisNotification;
import com.analysiswatch.core.model.JobPhase;
import com.analysiswatch.core.model.JobRecord;
import com.analysiswatch.core.model.NotificationKind;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Analysis Watch CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ANALYSIS WATCH v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WATCH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void jobs(List<JobRecord> jobs) {
        if (jobs.isEmpty()) {
            info("No analyses queued or running");
            return;
        }
        long running = jobs.stream().filter(j -> j.phase() == JobPhase.RUNNING).count();
        info(jobs.size() + " analys" + (jobs.size() != 1 ? "es" : "is") + " in progress ("
                + running + " running, " + (jobs.size() - running) + " queued)");
        for (JobRecord job : jobs) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  " + formatJob(job)));
        }
    }

    public static void notification(AnalysisNotification notification) {
        String prefix = notification.kind() == NotificationKind.SUCCESS
                ? "@|fg(green),bold [DONE]|@"
                : "@|fg(yellow) [INFO]|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + notification.message()));
    }

    static String formatJob(JobRecord job) {
        String phase = job.phase() == JobPhase.RUNNING
                ? "@|fg(blue) RUNNING|@"
                : "@|fg(white) QUEUED |@";
        String task = job.taskId() != null ? " (task " + job.taskId() + ")" : "";
        return phase + " " + job.displayLabel() + task;
    }
}
