/**
 * Provides the transport abstraction wrapped by the retry layer: the {@link com.sailfish.transport.Transport}
 * contract, the HTTP verbs it exposes and the request/response values it carries.
 * The retrying decorator itself lives in {@link com.sailfish.transport.impl}.
 */
package com.sailfish.transport;
