/**
 * QOI Codec — Wire-Level Boundary
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for the Quite OK
 * Image format. The codec layer implements the wire rules of the format:</p>
 *
 * <ul>
 *   <li>The 14-byte header (magic, dimensions, channels, colorspace)</li>
 *   <li>The opcode stream and its fixed opcode priority</li>
 *   <li>The 64-slot color cache and its hash function</li>
 *   <li>The 8-byte end marker</li>
 * </ul>
 *
 * <h2>Wire Contract</h2>
 * <p>Exactly one layout is supported: the 14-byte header variant with
 * colorspace tags {@code 0} (sRGB, linear alpha) and {@code 1} (all linear).
 * Encoder and decoder share the same opcode table; the layout is never
 * inferred from input beyond the magic signature.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   ImageView
 *        → QoiImageEncoder        (header, opcodes, end marker)
 *            → byte[] / OutputStream
 *
 *   byte[] / InputStream / QoiByteSource
 *        → QoiImageDecoder        (header validation, opcode interpretation)
 *            → QoiImage
 * </pre>
 *
 * <p>Stream adapters (for example the Netty handlers in
 * {@code com.questrail.imaging.qoi.transport.netty}) sit above this layer and
 * only ever reach the codec through these interfaces.</p>
 */
package com.questrail.imaging.qoi.codec;
