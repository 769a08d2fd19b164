package com.typewarden.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed view of the {@code typewarden.*} configuration tree.
 */
@Component
@ConfigurationProperties(prefix = "typewarden")
public class CampaignProperties {

    private Scanner scanner = new Scanner();
    private Replacer replacer = new Replacer();
    private TypeChecker typeChecker = new TypeChecker();
    private Campaign campaign = new Campaign();
    private Monitor monitor = new Monitor();
    private History history = new History();
    private Documentation documentation = new Documentation();

    public Scanner getScanner() { return scanner; }
    public void setScanner(Scanner scanner) { this.scanner = scanner; }
    public Replacer getReplacer() { return replacer; }
    public void setReplacer(Replacer replacer) { this.replacer = replacer; }
    public TypeChecker getTypeChecker() { return typeChecker; }
    public void setTypeChecker(TypeChecker typeChecker) { this.typeChecker = typeChecker; }
    public Campaign getCampaign() { return campaign; }
    public void setCampaign(Campaign campaign) { this.campaign = campaign; }
    public Monitor getMonitor() { return monitor; }
    public void setMonitor(Monitor monitor) { this.monitor = monitor; }
    public History getHistory() { return history; }
    public void setHistory(History history) { this.history = history; }
    public Documentation getDocumentation() { return documentation; }
    public void setDocumentation(Documentation documentation) { this.documentation = documentation; }

    public static class Scanner {
        private String sourceRoot = ".";
        private List<String> extensions = new ArrayList<>(List.of(".ts", ".tsx"));
        private List<String> excludeDirs = new ArrayList<>();
        private int contextLines = 3;

        public String getSourceRoot() { return sourceRoot; }
        public void setSourceRoot(String sourceRoot) { this.sourceRoot = sourceRoot; }
        public List<String> getExtensions() { return extensions; }
        public void setExtensions(List<String> extensions) { this.extensions = extensions; }
        public List<String> getExcludeDirs() { return excludeDirs; }
        public void setExcludeDirs(List<String> excludeDirs) { this.excludeDirs = excludeDirs; }
        public int getContextLines() { return contextLines; }
        public void setContextLines(int contextLines) { this.contextLines = contextLines; }
    }

    public static class Replacer {
        private String backupDirectory = ".typewarden/backups";
        private double safetyThreshold = 0.7;
        private int backupRetentionDays = 7;

        public String getBackupDirectory() { return backupDirectory; }
        public void setBackupDirectory(String backupDirectory) { this.backupDirectory = backupDirectory; }
        public double getSafetyThreshold() { return safetyThreshold; }
        public void setSafetyThreshold(double safetyThreshold) { this.safetyThreshold = safetyThreshold; }
        public int getBackupRetentionDays() { return backupRetentionDays; }
        public void setBackupRetentionDays(int backupRetentionDays) { this.backupRetentionDays = backupRetentionDays; }
    }

    public static class TypeChecker {
        private List<String> command = new ArrayList<>(List.of("npx", "tsc", "--noEmit", "--skipLibCheck"));
        private String workingDirectory = ".";
        private int timeoutSeconds = 30;

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public String getWorkingDirectory() { return workingDirectory; }
        public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Campaign {
        private int maxFilesPerBatch = 15;
        private int maxBatches = 10;
        private double minClassificationConfidence = 0.8;
        private double targetSuccessRate = 85.0;
        private boolean gitCheckpoint = false;

        public int getMaxFilesPerBatch() { return maxFilesPerBatch; }
        public void setMaxFilesPerBatch(int maxFilesPerBatch) { this.maxFilesPerBatch = maxFilesPerBatch; }
        public int getMaxBatches() { return maxBatches; }
        public void setMaxBatches(int maxBatches) { this.maxBatches = maxBatches; }
        public double getMinClassificationConfidence() { return minClassificationConfidence; }
        public void setMinClassificationConfidence(double minClassificationConfidence) { this.minClassificationConfidence = minClassificationConfidence; }
        public double getTargetSuccessRate() { return targetSuccessRate; }
        public void setTargetSuccessRate(double targetSuccessRate) { this.targetSuccessRate = targetSuccessRate; }
        public boolean isGitCheckpoint() { return gitCheckpoint; }
        public void setGitCheckpoint(boolean gitCheckpoint) { this.gitCheckpoint = gitCheckpoint; }
    }

    public static class Monitor {
        private boolean autoStart = false;
        private int intervalSeconds = 300;
        private double successRateThreshold = 70.0;
        private double classificationAccuracyThreshold = 80.0;
        private int buildFailureThreshold = 3;
        private int safetyEventThreshold = 5;
        private int progressStallHours = 24;
        private int dedupWindowMinutes = 60;
        private int errorMessageMaxLength = 500;

        public boolean isAutoStart() { return autoStart; }
        public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }
        public int getIntervalSeconds() { return intervalSeconds; }
        public void setIntervalSeconds(int intervalSeconds) { this.intervalSeconds = intervalSeconds; }
        public double getSuccessRateThreshold() { return successRateThreshold; }
        public void setSuccessRateThreshold(double successRateThreshold) { this.successRateThreshold = successRateThreshold; }
        public double getClassificationAccuracyThreshold() { return classificationAccuracyThreshold; }
        public void setClassificationAccuracyThreshold(double classificationAccuracyThreshold) { this.classificationAccuracyThreshold = classificationAccuracyThreshold; }
        public int getBuildFailureThreshold() { return buildFailureThreshold; }
        public void setBuildFailureThreshold(int buildFailureThreshold) { this.buildFailureThreshold = buildFailureThreshold; }
        public int getSafetyEventThreshold() { return safetyEventThreshold; }
        public void setSafetyEventThreshold(int safetyEventThreshold) { this.safetyEventThreshold = safetyEventThreshold; }
        public int getProgressStallHours() { return progressStallHours; }
        public void setProgressStallHours(int progressStallHours) { this.progressStallHours = progressStallHours; }
        public int getDedupWindowMinutes() { return dedupWindowMinutes; }
        public void setDedupWindowMinutes(int dedupWindowMinutes) { this.dedupWindowMinutes = dedupWindowMinutes; }
        public int getErrorMessageMaxLength() { return errorMessageMaxLength; }
        public void setErrorMessageMaxLength(int errorMessageMaxLength) { this.errorMessageMaxLength = errorMessageMaxLength; }
    }

    public static class History {
        private String directory = ".typewarden/history";
        private int alertCapacity = 1000;
        private int buildStabilityCapacity = 100;
        private int successRateCapacity = 365;

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public int getAlertCapacity() { return alertCapacity; }
        public void setAlertCapacity(int alertCapacity) { this.alertCapacity = alertCapacity; }
        public int getBuildStabilityCapacity() { return buildStabilityCapacity; }
        public void setBuildStabilityCapacity(int buildStabilityCapacity) { this.buildStabilityCapacity = buildStabilityCapacity; }
        public int getSuccessRateCapacity() { return successRateCapacity; }
        public void setSuccessRateCapacity(int successRateCapacity) { this.successRateCapacity = successRateCapacity; }
    }

    public static class Documentation {
        private int minimumCommentLength = 20;
        private List<String> requiredKeywords = new ArrayList<>(List.of("intentionally", "deliberately", "required", "needed"));
        private int excellentScore = 90;
        private int goodScore = 70;
        private int fairScore = 50;

        public int getMinimumCommentLength() { return minimumCommentLength; }
        public void setMinimumCommentLength(int minimumCommentLength) { this.minimumCommentLength = minimumCommentLength; }
        public List<String> getRequiredKeywords() { return requiredKeywords; }
        public void setRequiredKeywords(List<String> requiredKeywords) { this.requiredKeywords = requiredKeywords; }
        public int getExcellentScore() { return excellentScore; }
        public void setExcellentScore(int excellentScore) { this.excellentScore = excellentScore; }
        public int getGoodScore() { return goodScore; }
        public void setGoodScore(int goodScore) { this.goodScore = goodScore; }
        public int getFairScore() { return fairScore; }
        public void setFairScore(int fairScore) { this.fairScore = fairScore; }
    }
}
