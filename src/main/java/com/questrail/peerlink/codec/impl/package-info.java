/**
 * Codec implementations: the length-prefixed frame codec and the reassembly
 * buffer the stream reader feeds it from.
 */
package com.questrail.peerlink.codec.impl;
