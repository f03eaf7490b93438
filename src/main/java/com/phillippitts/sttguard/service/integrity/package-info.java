/**
 * Integrity verification of PCM payloads against client-declared length and checksum.
 */
package com.phillippitts.sttguard.service.integrity;
