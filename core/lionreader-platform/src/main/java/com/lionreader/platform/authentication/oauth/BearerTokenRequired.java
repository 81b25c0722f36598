package com.lionreader.platform.authentication.oauth;

import jakarta.ws.rs.NameBinding;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a resource or resource method as requiring a valid OAuth access token
 * in the Authorization header.
 *
 * The authenticated token is available from {@link BearerTokenContext}.
 *
 * @see BearerTokenFilter
 */
@NameBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface BearerTokenRequired {
}
