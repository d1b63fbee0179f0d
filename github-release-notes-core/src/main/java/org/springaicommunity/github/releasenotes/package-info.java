/**
 * GitHub release notes core package.
 *
 * <p>
 * Classifies the commits between two refs, attributes them to their authors and renders
 * a categorized release-note document.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.github.releasenotes;

import org.jspecify.annotations.NullMarked;
