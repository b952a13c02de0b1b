package com.bank.fraud.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Every tunable number of the monitoring pipeline. The defaults below are the values
 * observed in production call sites; deployments override them in application.yml
 * under the {@code monitoring} prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "monitoring")
public class MonitoringConfig {

    // Scores at or above this go to manual review (unless a hard override blocks them)
    private double manualReviewThreshold = 0.6;

    // Rule sets composed into the catalog, in evaluation order
    private List<String> ruleSets = new ArrayList<>(List.of(
            "core", "mule", "beneficiary", "vendor", "payroll", "ato",
            "timing", "geo", "device", "history", "check"));

    // Per-rule weight overrides keyed by fully prefixed rule name, e.g. "core.large_amount"
    private Map<String, Double> ruleWeights = new HashMap<>();

    // Fully prefixed rule names to leave out of the catalog
    private List<String> disabledRules = new ArrayList<>();

    private Scoring scoring = new Scoring();

    private Assembly assembly = new Assembly();

    // How often the reference-table snapshot (blacklist, VPN, high-risk locations) is reloaded
    private long referenceRefreshMs = 300_000;

    private Signals signals = new Signals();

    private RuleThresholds rules = new RuleThresholds();

    @Data
    public static class Scoring {
        // score = min(sum(weights) / normalizationDivisor, 1.0)
        private double normalizationDivisor = 10.0;
    }

    @Data
    public static class Assembly {
        // Run signal groups concurrently; when false they still run on the executor, one at a time
        private boolean parallel = true;
        private int threads = 16;
        private long groupTimeoutMs = 2_000;
        private long deadlineMs = 5_000;
    }

    @Data
    public static class Signals {
        // velocity
        private List<Integer> velocityWindowsHours = new ArrayList<>(List.of(1, 6, 24, 168));
        private double smallDepositThreshold = 10.0;
        private List<String> inboundTypes = new ArrayList<>(List.of(
                "DEPOSIT", "ACH", "ACH_CREDIT", "TRANSFER_IN", "WIRE_IN", "ZELLE", "P2P"));
        private int amountLookbackDays = 90;
        private double coldStartDeviation = 5.0;
        private double smallTestThreshold = 50.0;
        private int smallTestLookbackHours = 24;

        // money mule
        private List<Integer> muleWindowsHours = new ArrayList<>(List.of(24, 72, 168));
        private int transferGapWindowHours = 168;

        // beneficiary freshness and bank-detail changes
        private List<Integer> beneficiaryWindowsHours = new ArrayList<>(List.of(24, 72, 168));
        private int newBeneficiaryHours = 48;
        private int sameDayChangeHours = 24;
        private int criticalChangeWindowDays = 7;
        private int rapidChangeWindowDays = 30;
        private List<String> suspiciousChangeSources = new ArrayList<>(List.of(
                "email_request", "phone_request", "fax"));
        // An outbound debit is a vendor payment when its type or description matches
        private List<String> vendorPaymentTypes = new ArrayList<>(List.of(
                "ACH_DEBIT", "WIRE_TRANSFER", "PAYMENT", "VENDOR_PAYMENT", "SUPPLIER_PAYMENT"));
        private List<String> vendorPaymentKeywords = new ArrayList<>(List.of(
                "payment", "invoice", "vendor", "supplier", "contractor"));

        // account takeover
        private List<Integer> atoWindowsHours = new ArrayList<>(List.of(24, 72, 168));

        // odd hours
        private int oddHoursStart = 22;
        private int oddHoursEnd = 6;
        private String timezone = "UTC";
        private int timingLookbackDays = 90;
        private int minTimingSamples = 10;
        // Below this historical share, odd-hour/weekend activity is unusual for the account
        private double patternDeviationRatio = 0.1;

        // geolocation
        private int geoLookbackDays = 180;
        private double primaryCountryShare = 0.8;
        private double maxTravelSpeedKmh = 900.0;
        private double minTravelDistanceKm = 100.0;

        // device
        private int deviceLookbackDays = 90;
        private int deviceSharingWindowDays = 30;

        // behavioral biometrics
        private int biometricLookbackDays = 90;
        private int biometricMinSamples = 5;
        private double biometricZThreshold = 2.0;
        private double autofillHighShare = 0.8;
        private double autofillLowShare = 0.2;

        // relationship buckets (days)
        private int relationshipNewDays = 30;
        private int relationshipActiveDays = 30;
        private int relationshipRecentDays = 90;
        private int relationshipDormantDays = 180;

        // account age buckets (days)
        private int brandNewAccountDays = 1;
        private int criticalAccountAgeDays = 7;
        private int highRiskAccountAgeDays = 30;
        private int mediumRiskAccountAgeDays = 90;
        private int lowRiskAccountAgeDays = 365;
        private int youngAccountDays = 90;
        private double largeTransactionAmount = 10_000.0;

        // prior fraud history
        private int fraudHistoryLookbackDays = 1095;
        private int fraudRecentDays = 180;
        private int repeatOffenderCount = 2;

        // check deposits
        private int checkLookbackDays = 90;
        private List<String> checkTypes = new ArrayList<>(List.of(
                "CHECK", "CHECK_DEPOSIT", "MOBILE_DEPOSIT", "REMOTE_DEPOSIT"));
    }

    @Data
    public static class RuleThresholds {
        private double largeAmount = 10_000.0;
        private int velocityCount1h = 5;
        private int velocityCount24h = 20;
        private int smallDepositCount24h = 3;
        private double amountDeviationSigma = 3.0;

        private int lowActivityCount = 5;
        private double lowActivityMultiplier = 3.0;
        private double lowActivityMinAmount = 1_000.0;

        private int smallTestMinCount = 3;
        private double smallTestLargeAmount = 1_000.0;
        private List<String> withdrawalTypes = new ArrayList<>(List.of(
                "WITHDRAWAL", "WIRE", "ACH_OUT", "TRANSFER_OUT"));

        private int muleMinIncoming = 5;
        private double muleFlowThroughRatio = 0.8;
        private double muleMaxAvgIncoming = 1_000.0;
        private double muleMaxHoursToTransfer = 24.0;

        private double newBeneficiaryPaymentRatio = 0.7;
        private int bulkBeneficiaryCount = 5;
        private int sameSourceBeneficiaryCount = 5;
        private double highValueBeneficiaryAmount = 10_000.0;
        private int rapidChangeCount = 3;

        private List<String> payrollTypes = new ArrayList<>(List.of("PAYROLL", "DIRECT_DEPOSIT", "SALARY"));
        private double payrollDeviationSigma = 3.0;

        private double atoMaxHoursSinceChange = 72.0;

        private double minTrustScore = 30.0;
        private int behavioralMinDeviations = 2;
        private int deviceSharingAccounts = 3;
        private double vpnMinConfidence = 0.7;
    }
}
