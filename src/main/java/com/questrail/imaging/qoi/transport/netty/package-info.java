/**
 * Netty stream adapters for the QOI codec.
 *
 * <p>{@link com.questrail.imaging.qoi.transport.netty.QoiNettyImageEncoder} and
 * {@link com.questrail.imaging.qoi.transport.netty.QoiNettyImageDecoder} let a
 * Netty pipeline carry QOI images over any byte channel. They never apply wire
 * rules themselves; all opcode and header logic stays in
 * {@code com.questrail.imaging.qoi.codec}.</p>
 *
 * <p>Netty types MUST NOT escape this package.</p>
 */
package com.questrail.imaging.qoi.transport.netty;
