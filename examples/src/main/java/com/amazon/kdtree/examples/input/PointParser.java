/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.kdtree.examples.input;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.kdtree.tree.Point;

/**
 * Reads points written one per line as two whitespace separated numbers. Lines
 * that do not contain exactly two numbers are skipped.
 */
public class PointParser {

    private static final Logger logger = LoggerFactory.getLogger(PointParser.class);

    private static final Pattern SEPARATOR = Pattern.compile("\\s+");

    public List<Point> parse(String text) {
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            // a StringReader does not fail
            throw new UncheckedIOException(e);
        }
    }

    public List<Point> parse(Reader reader) throws IOException {
        List<Point> points = new ArrayList<>();
        BufferedReader lines = new BufferedReader(reader);
        String line;
        int lineNumber = 0;
        while ((line = lines.readLine()) != null) {
            ++lineNumber;
            Point point = parseLine(line);
            if (point != null) {
                points.add(point);
            } else if (!line.trim().isEmpty()) {
                logger.debug("skipping line {}: '{}'", lineNumber, line);
            }
        }
        return points;
    }

    /**
     * @param line a line of input
     * @return the point on the line, or null if the line does not hold exactly two
     *         numbers
     */
    Point parseLine(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        String[] parts = SEPARATOR.split(trimmed);
        if (parts.length != 2) {
            return null;
        }
        try {
            double x = Double.parseDouble(parts[0]);
            double y = Double.parseDouble(parts[1]);
            if (!Double.isFinite(x) || !Double.isFinite(y)) {
                return null;
            }
            return new Point(x, y);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
