/**
 * SEI Codec (Wire-Level)
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for SEI NAL units
 * carrying {@code user_data_unregistered} messages. The codec layer implements
 * the wire rules of ITU-T H.264:</p>
 *
 * <ul>
 *   <li>NAL unit delimiting (Annex B start codes or 4-byte length prefixes)</li>
 *   <li>Emulation prevention insertion and removal (§7.4.1)</li>
 *   <li>SEI message syntax: ff-extension coded type and size (§7.3.2.3.1)</li>
 *   <li>RBSP trailing bits</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] access unit
 *        → SeiNalDecoder        (wire rules applied here)
 *            → SeiMessage       (post-unescape, type/size resolved)
 *                → MetadataRecordDecoder
 *                    → MetadataRecord
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>{@code SeiMessage} is <strong>not</strong> a wire parser or encoder.</li>
 *   <li>All byte-level mechanics live exclusively in this codec layer.</li>
 *   <li>Nothing here knows about JSON or frame counters.</li>
 * </ul>
 */
package com.questrail.h264meta.codec;
