/*
 *    Copyright 2009-2021 the original author or authors.
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */
/**
 * Parsing utils.
 * The raw text first goes through {@link org.mathparse.mathml.parsing.EntitySanitizer}, then
 * {@link org.mathparse.mathml.parsing.XmlDocumentParser} turns it into a DOM whose nodes are read through
 * {@link org.mathparse.mathml.parsing.XNode}.
 */
package org.mathparse.mathml.parsing;
