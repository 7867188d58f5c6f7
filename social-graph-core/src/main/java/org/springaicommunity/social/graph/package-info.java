/**
 * Social Graph client core package.
 *
 * <p>
 * Contains the request dispatcher, the credential verifier for cookie sessions and signed
 * requests, the token exchange client, and the thin Graph and REST endpoint modules built
 * on top of them.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.social.graph;

import org.jspecify.annotations.NullMarked;
