package com.company.decommissioning.service;

import com.company.decommissioning.config.DecommissioningProperties;
import com.company.decommissioning.domain.ThresholdPolicy;
import com.company.decommissioning.domain.enums.Criticality;
import com.company.decommissioning.domain.enums.ScenarioType;
import com.company.decommissioning.exception.PolicyConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Derives threshold policies from (criticality, scenario). The effective tier is the
 * stricter of the criticality and the scenario's baseline tier, so a LOGIC_HEAVY
 * database is watched as closely as a CRITICAL one.
 */
@Component
@Slf4j
public class ThresholdPolicyResolver {

    private final Map<Criticality, ThresholdPolicy> policiesByTier;

    public ThresholdPolicyResolver(DecommissioningProperties properties) {
        this.policiesByTier = buildPolicies(properties);
        policiesByTier.forEach((tier, policy) ->
                log.info("Threshold tier {}: warning={}s critical={}s warningRecovery={}s criticalRecovery={}s",
                        tier, policy.getWarningSeconds(), policy.getCriticalSeconds(),
                        policy.getWarningRecoverySeconds(), policy.getCriticalRecoverySeconds()));
    }

    public ThresholdPolicy resolve(Criticality criticality, ScenarioType scenario) {
        return policiesByTier.get(Criticality.stricter(criticality, scenario.getBaseline()));
    }

    private static Map<Criticality, ThresholdPolicy> buildPolicies(DecommissioningProperties properties) {
        List<String> problems = new ArrayList<>();
        double warningRatio = properties.getWarningRecoveryRatio();
        double criticalRatio = properties.getCriticalRecoveryRatio();

        if (!(warningRatio > 0 && warningRatio < 1)) {
            problems.add("warning-recovery-ratio must be between 0 and 1 exclusive, was " + warningRatio);
        }
        if (!(criticalRatio > 0 && criticalRatio < 1)) {
            problems.add("critical-recovery-ratio must be between 0 and 1 exclusive, was " + criticalRatio);
        }

        Map<Criticality, ThresholdPolicy> policies = new EnumMap<>(Criticality.class);
        for (Criticality tier : Criticality.values()) {
            DecommissioningProperties.Window window = properties.getWindows().get(tier);
            if (window == null || window.getCritical() == null || window.getWarning() == null) {
                problems.add("windows." + tier + " must define both critical and warning");
                continue;
            }

            long critical = window.getCritical().getSeconds();
            long warning = window.getWarning().getSeconds();
            if (warning <= 0 || critical <= warning) {
                problems.add("windows." + tier + " requires 0 < warning < critical, was warning="
                        + warning + "s critical=" + critical + "s");
                continue;
            }

            policies.put(tier, ThresholdPolicy.builder()
                    .tier(tier)
                    .criticalSeconds(critical)
                    .warningSeconds(warning)
                    .criticalRecoverySeconds(recoveryBound(critical, criticalRatio))
                    .warningRecoverySeconds(recoveryBound(warning, warningRatio))
                    .build());
        }

        if (!problems.isEmpty()) {
            throw new PolicyConfigException(problems);
        }
        return policies;
    }

    private static long recoveryBound(long trigger, double ratio) {
        // floor keeps the bound strictly below the trigger for any ratio < 1
        return (long) Math.floor(trigger * ratio);
    }
}
