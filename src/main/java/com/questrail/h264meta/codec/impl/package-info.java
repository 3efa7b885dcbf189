/**
 * SEI Codec (Wire-Level Implementation)
 * =============================================================================
 *
 * <p>Concrete codec implementation bridging host buffers and
 * {@code SeiMessage} instances.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] buffer
 *        → NalUnitScanner.scan
 *        → EmulationPrevention.decode
 *        → SeiPayloadCoding.Reader
 *        → SeiMessage
 * </pre>
 *
 * <p>This codec layer is strictly:</p>
 * <ul>
 *   <li>format-faithful</li>
 *   <li>transport-agnostic</li>
 *   <li>semantics-free</li>
 * </ul>
 *
 * <p>A wire-level failure drops the affected NAL unit's remaining messages,
 * never the whole buffer.</p>
 */
package com.questrail.h264meta.codec.impl;
