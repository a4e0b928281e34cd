/*
 * Copyright 2026 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventcore.domain.shoppingcart;

import static java.util.Objects.requireNonNull;

public record PricedProductItem(String productId, int quantity, double price) {
    public PricedProductItem {
        requireNonNull(productId, "productId cannot be null");
    }

    public double totalPrice() {
        return quantity * price;
    }
}
