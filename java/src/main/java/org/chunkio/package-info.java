//  Copyright (c) Meta Platforms, Inc. and affiliates.
//  This source code is licensed under both the GPLv2 (found in the
//  COPYING file in the root directory) and Apache 2.0 License
//  (found in the LICENSE.Apache file in the root directory).

/**
 * Compression options and frozen chunk tags of the chunked record file format
 * <p>
 * {@link org.chunkio.CompressorOptions} holds the compression selection used
 * when chunks are encoded; {@link org.chunkio.ChunkType} and
 * {@link org.chunkio.CompressionType} name the tags written into chunk headers.
 * </p>
 */
package org.chunkio;
