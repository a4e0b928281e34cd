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

import org.eventcore.domain.shoppingcart.ShoppingCartEvent.DiscountApplied;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.ProductItemAdded;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.ProductItemRemoved;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.ShoppingCartConfirmed;

import java.util.Set;

/**
 * A read model of a shopping cart.
 */
public record ShoppingCartDetails(int productItemsCount, double totalAmount, ShoppingCartStatus status) {
    public static final String COLLECTION_NAME = "shoppingCartDetails";

    public static final Set<String> HANDLED_EVENT_TYPES = Set.of(
            ProductItemAdded.class.getSimpleName(),
            ProductItemRemoved.class.getSimpleName(),
            DiscountApplied.class.getSimpleName(),
            ShoppingCartConfirmed.class.getSimpleName());

    public static ShoppingCartDetails initial() {
        return new ShoppingCartDetails(0, 0, ShoppingCartStatus.EMPTY);
    }

    public static ShoppingCartDetails evolve(ShoppingCartDetails document, ShoppingCartEvent event) {
        if (event instanceof ProductItemAdded e) {
            return new ShoppingCartDetails(document.productItemsCount + e.productItem().quantity(),
                    document.totalAmount + e.productItem().totalPrice(), ShoppingCartStatus.OPENED);
        } else if (event instanceof ProductItemRemoved e) {
            return new ShoppingCartDetails(document.productItemsCount - e.productItem().quantity(),
                    document.totalAmount - e.productItem().totalPrice(), document.status);
        } else if (event instanceof DiscountApplied e) {
            return new ShoppingCartDetails(document.productItemsCount, document.totalAmount * (1 - e.percent() / 100), document.status);
        } else if (event instanceof ShoppingCartConfirmed) {
            return new ShoppingCartDetails(document.productItemsCount, document.totalAmount, ShoppingCartStatus.CONFIRMED);
        }
        return document;
    }
}
