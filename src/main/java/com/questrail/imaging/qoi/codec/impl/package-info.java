/**
 * QOI Codec — Wire-Level Implementation
 * =============================================================================
 *
 * <p>This package contains the concrete QOI engine behind the
 * {@code com.questrail.imaging.qoi.codec} interfaces.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   encode:
 *     ImageView
 *        → QoiHeader.forImage / QoiHeaderCodec.encode
 *        → QoiPixelEncoder.push   (run coalescing, opcode choice, QoiColorCache)
 *        → QoiPixelEncoder.finish (end marker)
 *
 *   decode:
 *     QoiByteSource
 *        → QoiHeaderCodec.read
 *        → QoiPixelDecoder.fetch  (QoiOpcode.classify, QoiColorCache)
 *        → QoiImage
 * </pre>
 *
 * <p>This codec layer is strictly:</p>
 * <ul>
 *   <li>byte-exact with respect to the format</li>
 *   <li>transport-agnostic</li>
 *   <li>free of shared mutable state: every call owns its cache and run state</li>
 * </ul>
 */
package com.questrail.imaging.qoi.codec.impl;
