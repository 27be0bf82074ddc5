package com.questrail.filetransfer.transport.tls;

/**
 * Host-name verification policy for the client side of a secure channel.
 *
 * <p>Only {@link #DISABLED} exists. The client validates the server's
 * certificate chain against its single trust anchor but does not match the
 * certificate's names against the host it dialled. This is a reduced-security
 * mode intended for controlled deployments using a self-signed certificate
 * reached by IP address.</p>
 */
public enum HostnameVerification
{
    DISABLED
}
