package com.webfront.core.server;

import com.webfront.config.ListenerConfig;
import com.webfront.config.WebfrontProperties;
import com.webfront.core.routing.HostAuthorizer;
import com.webfront.core.routing.HostRouter;
import com.webfront.core.services.AccessLogService;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Creates {@link FrontServer} instances for listener configurations, wiring in
 * the shared router and services.
 */
public class FrontServerFactory {

    private final HostRouter router;
    private final HostAuthorizer authorizer;
    private final AccessLogService accessLog;
    private final MeterRegistry registry;
    private final WebfrontProperties globalProps;

    /**
     * @param router      Shared request router.
     * @param authorizer  Shared host policy.
     * @param accessLog   The access log writer.
     * @param registry    The Micrometer meter registry.
     * @param globalProps The global configuration.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public FrontServerFactory(HostRouter router, HostAuthorizer authorizer, AccessLogService accessLog,
            MeterRegistry registry, WebfrontProperties globalProps) {
        this.router = router;
        this.authorizer = authorizer;
        this.accessLog = accessLog;
        this.registry = registry;
        this.globalProps = globalProps;
    }

    /**
     * @param config The listener configuration.
     * @return A new, not yet started server.
     */
    public FrontServer create(ListenerConfig config) {
        return new HttpFrontServer(config, globalProps, router, authorizer, accessLog, registry);
    }
}
