package org.stackup.persist;

import org.stackup.tolerance.ToleranceChain;

/**
 * 单条公差链的持久化形态。
 */
public record ChainDocument(int schemaVersion, ToleranceChain chain) {
}
