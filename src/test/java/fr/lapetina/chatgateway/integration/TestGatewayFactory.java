package fr.lapetina.chatgateway.integration;

import fr.lapetina.chatgateway.GatewayFactory;
import fr.lapetina.chatgateway.infrastructure.upstream.ScriptedSessionAdapter;

import java.util.Map;

/**
 * Test extension of GatewayFactory with a scripted upstream and a fixed
 * credential environment of three accounts.
 */
public final class TestGatewayFactory extends GatewayFactory {

    static final Map<String, String> DEFAULT_ENV = Map.of(
            "CREDENTIAL_1_PRIMARY", "primary-1",
            "CREDENTIAL_1_SECONDARY", "secondary-1",
            "CREDENTIAL_1_NAME", "Alpha",
            "CREDENTIAL_2_PRIMARY", "primary-2",
            "CREDENTIAL_2_NAME", "Beta",
            "CREDENTIAL_3_PRIMARY", "primary-3",
            "CREDENTIAL_3_NAME", "Gamma"
    );

    private final ScriptedSessionAdapter upstream;

    private TestGatewayFactory(String configPath, Map<String, String> env, ScriptedSessionAdapter upstream) {
        super(configPath, env::get, upstream);
        this.upstream = upstream;
    }

    /**
     * Creates a started test factory from the default test configuration.
     */
    public static TestGatewayFactory create() {
        return create("test-config.yaml", DEFAULT_ENV);
    }

    /**
     * Creates a started test factory from a custom configuration and environment.
     */
    public static TestGatewayFactory create(String configPath, Map<String, String> env) {
        TestGatewayFactory factory = new TestGatewayFactory(configPath, env, new ScriptedSessionAdapter());
        factory.start();
        return factory;
    }

    public ScriptedSessionAdapter getUpstream() {
        return upstream;
    }
}
