/**
 * Command-line front end for the Basecamp SDK.
 */
@NullMarked
package com.basecamp.sdk.cli;

import org.jspecify.annotations.NullMarked;
