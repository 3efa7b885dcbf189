/**
 * Netty Pipeline Adapters
 * =============================================================================
 *
 * Handlers that attach SEI metadata injection and extraction to a Netty
 * channel pipeline carrying encoded H.264 access units.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code ChannelHandlerContext}, {@code ByteBuf}) MUST NOT
 * escape this package. Everything below it works on {@code byte[]} and
 * {@link com.questrail.h264meta.api.EncodedFrame}.
 *
 * <h2>Architectural constraints</h2>
 * Handlers in this package MUST:
 * <ul>
 *   <li>Delegate all SEI decisions to the injector or collector</li>
 *   <li>Not parse NAL units themselves</li>
 *   <li>Leave buffer ownership with the pipeline</li>
 * </ul>
 */
package com.questrail.h264meta.transport.netty;
