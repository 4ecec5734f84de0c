package fr.lapetina.chatgateway.infrastructure.upstream;

import fr.lapetina.chatgateway.domain.pool.CredentialRecord;

/**
 * Boundary to the upstream chat service.
 *
 * Implementations authenticate with the given credential's secret pair and
 * must be safe for concurrent use. They never mutate credential state; the
 * dispatcher reports outcomes to the pool.
 */
public interface SessionAdapter {

    /**
     * Starts generating a reply.
     *
     * @param credential    the credential to authenticate with
     * @param prompt        the flattened conversation
     * @param upstreamModel the resolved upstream model id
     * @return the reply, ready to be consumed
     * @throws UpstreamException if the upstream rejects or fails the request
     */
    UpstreamReply send(CredentialRecord credential, String prompt, String upstreamModel) throws UpstreamException;
}
