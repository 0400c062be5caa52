/**
 * Configuration Codec
 * =============================================================================
 *
 * <p>Translation between diagram documents and the runtime configuration text,
 * the only contract shared with the external control runtime.</p>
 *
 * <pre>
 *   Document
 *        → ConfigGenerator     (canonical naming, wire resolution)
 *            → RuntimeConfig   (codec.model, property order fixed)
 *                → YAML text
 *
 *   YAML text
 *        → ConfigParser        (tolerant, fixed layout)
 *            → ParsedDiagram   (document + diagnostics)
 * </pre>
 *
 * <h2>Round trip</h2>
 * <p>For documents whose block ports are wired only to signals, parsing the
 * generated text reproduces the same signals, blocks and port wiring. Node ids
 * and positions are not preserved.</p>
 *
 * <p>A block port is written under the name of the node at the other end of its
 * edge, so a direct block-to-block wire appears as the downstream block's name
 * on the upstream output and the upstream block's name on the downstream input.
 * Neither is a declared signal, so the parser cannot rebuild the wire and
 * reports both ends as diagnostics instead. This asymmetry is permanent: the text
 * format has no way to declare an anonymous wire.</p>
 */
package com.questrail.designer.codec;
