/**
 * Sequencing file publisher core: archive decomposition, ownership resolution, name
 * matching, per-project bundling and publishing through the Clarity REST API.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.seqfile.publisher;

import org.jspecify.annotations.NullMarked;
