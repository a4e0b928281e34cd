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

import java.util.ArrayList;
import java.util.List;

public record ShoppingCart(List<PricedProductItem> productItems, double totalAmount, ShoppingCartStatus status) {

    public ShoppingCart {
        productItems = List.copyOf(productItems);
    }

    public static ShoppingCart initial() {
        return new ShoppingCart(List.of(), 0, ShoppingCartStatus.EMPTY);
    }

    public static ShoppingCart evolve(ShoppingCart state, ShoppingCartEvent event) {
        if (event instanceof ProductItemAdded e) {
            List<PricedProductItem> productItems = new ArrayList<>(state.productItems);
            productItems.add(e.productItem());
            return new ShoppingCart(productItems, state.totalAmount + e.productItem().totalPrice(), ShoppingCartStatus.OPENED);
        } else if (event instanceof ProductItemRemoved e) {
            List<PricedProductItem> productItems = new ArrayList<>(state.productItems);
            productItems.removeIf(productItem -> productItem.productId().equals(e.productItem().productId()));
            return new ShoppingCart(productItems, state.totalAmount - e.productItem().totalPrice(), state.status);
        } else if (event instanceof DiscountApplied e) {
            return new ShoppingCart(state.productItems, state.totalAmount * (1 - e.percent() / 100), state.status);
        } else if (event instanceof ShoppingCartConfirmed) {
            return new ShoppingCart(state.productItems, state.totalAmount, ShoppingCartStatus.CONFIRMED);
        }
        return state;
    }

    public boolean isConfirmed() {
        return status == ShoppingCartStatus.CONFIRMED;
    }

    public int productItemsCount() {
        return productItems.stream().mapToInt(PricedProductItem::quantity).sum();
    }
}
