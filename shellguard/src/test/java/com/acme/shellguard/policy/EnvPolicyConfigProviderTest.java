package com.acme.shellguard.policy;

import com.acme.shellguard.util.ShellGuardDefaults;
import com.acme.shellguard.util.ShellGuardEnvKeys;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvPolicyConfigProviderTest {

    @Test
    void shouldUseDefaultsWhenNothingIsConfigured() {
        PolicyConfig config = EnvPolicyConfigProvider.fromEnvironment(Map.of()).activeConfig();

        assertTrue(config.allowList().isEmpty());
        assertEquals(ShellGuardDefaults.DEFAULT_BLOCKED_COMMANDS, config.denyList());
        assertTrue(config.complianceMode());
    }

    @Test
    void shouldParseSemicolonSeparatedPatterns() {
        PolicyConfig config = EnvPolicyConfigProvider.fromEnvironment(Map.of(
            ShellGuardEnvKeys.SHELLGUARD_ALLOWED_COMMANDS, "git; ls ;;kubectl get",
            ShellGuardEnvKeys.SHELLGUARD_BLOCKED_COMMANDS, "shutdown",
            ShellGuardEnvKeys.SHELLGUARD_COMPLIANCE_MODE, "false"
        )).activeConfig();

        assertEquals(List.of("git", "ls", "kubectl get"), config.allowList());
        assertEquals(List.of("shutdown"), config.denyList());
        assertFalse(config.complianceMode());
    }

    @Test
    void shouldAllowExplicitlyEmptyDenyList() {
        PolicyConfig config = EnvPolicyConfigProvider.fromEnvironment(Map.of(
            ShellGuardEnvKeys.SHELLGUARD_BLOCKED_COMMANDS, ""
        )).activeConfig();

        assertTrue(config.denyList().isEmpty());
    }

    @Test
    void shouldSwapConfigOnRefresh() {
        EnvPolicyConfigProvider provider = EnvPolicyConfigProvider.fromEnvironment(Map.of());
        PolicyEngine engine = new DefaultPolicyEngine();
        assertEquals(SafetyTier.SAFE, engine.evaluate("docker ps", provider.activeConfig()).tier());

        provider.refresh(Map.of(ShellGuardEnvKeys.SHELLGUARD_ALLOWED_COMMANDS, "git"));

        assertEquals(SafetyTier.BLOCKED, engine.evaluate("docker ps", provider.activeConfig()).tier());
    }
}
