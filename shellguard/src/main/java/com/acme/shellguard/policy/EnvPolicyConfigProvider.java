package com.acme.shellguard.policy;

import com.acme.shellguard.util.EnvVars;
import com.acme.shellguard.util.ShellGuardDefaults;
import com.acme.shellguard.util.ShellGuardEnvKeys;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Builds the active {@link PolicyConfig} from environment variables.
 *
 * <p>Allow and deny patterns are {@code ;}-separated. The snapshot is swapped atomically on
 * {@link #refresh(Map)} so concurrent evaluators always see one complete configuration.</p>
 */
public final class EnvPolicyConfigProvider {
    private static final Logger LOG = Logger.getLogger(EnvPolicyConfigProvider.class.getName());

    private final AtomicReference<PolicyConfig> configRef = new AtomicReference<>(PolicyConfig.permissive());

    private EnvPolicyConfigProvider() {
    }

    public static EnvPolicyConfigProvider fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static EnvPolicyConfigProvider fromEnvironment(Map<String, String> env) {
        EnvPolicyConfigProvider provider = new EnvPolicyConfigProvider();
        provider.refresh(env);
        return provider;
    }

    public void refresh(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        List<String> allowed = EnvVars.getList(env, ShellGuardEnvKeys.SHELLGUARD_ALLOWED_COMMANDS, List.of());
        List<String> blocked = EnvVars.getList(
            env, ShellGuardEnvKeys.SHELLGUARD_BLOCKED_COMMANDS, ShellGuardDefaults.DEFAULT_BLOCKED_COMMANDS);
        boolean compliance = EnvVars.getBoolean(
            env, ShellGuardEnvKeys.SHELLGUARD_COMPLIANCE_MODE, ShellGuardDefaults.DEFAULT_COMPLIANCE_MODE);

        PolicyConfig config = new PolicyConfig(allowed, blocked, compliance);
        configRef.set(config);
        LOG.fine(() -> "Policy loaded: allow=" + config.allowList().size()
            + " deny=" + config.denyList().size() + " compliance=" + config.complianceMode());
    }

    public PolicyConfig activeConfig() {
        return configRef.get();
    }
}
