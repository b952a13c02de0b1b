package com.bank.fraud.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AerospikeConfig {

    // Ledger sets (read-only from the monitoring pipeline)
    public static final String SET_TRANSACTIONS = "transactions";
    public static final String SET_ACCOUNTS = "accounts";
    public static final String SET_BENEFICIARIES = "beneficiaries";
    public static final String SET_BENEFICIARY_CHANGES = "bene_changes";
    public static final String SET_ACCOUNT_CHANGES = "account_changes";
    public static final String SET_DEVICE_SESSIONS = "device_sessions";
    public static final String SET_BIOMETRIC_SAMPLES = "biometric_samples";
    public static final String SET_FRAUD_FLAGS = "fraud_flags";

    // Reference tables
    public static final String SET_BLACKLIST = "blacklist";
    public static final String SET_VPN_PROXY = "vpn_proxy";
    public static final String SET_HIGH_RISK_LOCATIONS = "high_risk_locations";

    // Written by the pipeline
    public static final String SET_ASSESSMENTS = "risk_assessments";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:banking}")
    private String namespace;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 300;
        clientPolicy.timeout = 5000;
        clientPolicy.failIfNotConnected = true;

        clientPolicy.readPolicyDefault.totalTimeout = 3000;
        clientPolicy.readPolicyDefault.socketTimeout = 1000;

        clientPolicy.writePolicyDefault.totalTimeout = 3000;
        clientPolicy.writePolicyDefault.socketTimeout = 1000;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }

    /**
     * Create-only writes: a second insert for the same key fails with KEY_EXISTS_ERROR
     * instead of overwriting the stored assessment.
     */
    @Bean
    public WritePolicy createOnlyWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        policy.sendKey = true;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
