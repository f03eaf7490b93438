/**
 * Wire format of the data channel.
 *
 * <pre>
 * [4 bytes LE uint32 metadataLength][metadataLength bytes UTF-8 JSON][N x 2 bytes PCM16 LE]
 * </pre>
 *
 * @see com.phillippitts.sttguard.service.protocol.FrameCodec
 */
package com.phillippitts.sttguard.service.protocol;
