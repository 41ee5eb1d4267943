/**
 * Basecamp SDK core package.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package com.basecamp.sdk;

import org.jspecify.annotations.NullMarked;
