/**
 * Decoding of form request bodies.
 *
 * <p>{@link org.bluezoo.portico.form.FormDecoder} handles
 * {@code application/x-www-form-urlencoded} and
 * {@code multipart/form-data} bodies. Text fields are presented as
 * {@link org.bluezoo.portico.form.FieldValue}s of strings, uploaded files
 * as {@link org.bluezoo.portico.form.FileUpload}s whose content is only
 * ever available as raw bytes. Large uploads are spooled to temporary
 * files according to a {@link org.bluezoo.portico.form.MultipartConfig};
 * releasing the {@link org.bluezoo.portico.form.FormData} deletes them.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.portico.form;
