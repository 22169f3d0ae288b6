package com.fieldops.sync.client;

/**
 * Authentication state of {@link TelematicsClient}.
 *
 * <pre>
 *   UNAUTHENTICATED --authenticate()------------------&gt; AUTHENTICATING
 *   AUTHENTICATING  --success--------------------------&gt; AUTHENTICATED
 *   AUTHENTICATING  --rate limited---------------------&gt; RATE_LIMITED (resetAt = now + cooldown)
 *   AUTHENTICATING  --other failure, retries remain----&gt; UNAUTHENTICATED (retry scheduled)
 *   AUTHENTICATING  --other failure, retries exhausted-&gt; UNAUTHENTICATED (terminal)
 *   RATE_LIMITED    --now &gt;= resetAt-------------------&gt; UNAUTHENTICATED
 * </pre>
 */
public enum AuthState {
    UNAUTHENTICATED,
    AUTHENTICATING,
    AUTHENTICATED,
    RATE_LIMITED
}
