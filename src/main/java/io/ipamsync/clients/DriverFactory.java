package io.ipamsync.clients;

import io.ipamsync.models.ApiEndpoint;

/**
 * Opens authenticated handles to target endpoints. The caller owns the returned handle
 * and must close it.
 *
 * @throws IllegalArgumentException from every method when the endpoint is unusable (missing or malformed URL)
 */
public interface DriverFactory {

    NetboxClient openIpam(ApiEndpoint endpoint);

    FortiOSClient openFirewall(ApiEndpoint endpoint);

    NsxClient openSecurityPlatform(ApiEndpoint endpoint);
}
